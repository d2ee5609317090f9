package dk.cloudcreate.essentials.fmodel.application.test_data;

public sealed interface CounterCommand {
    String counterId();

    record Increment(String counterId, int amount) implements CounterCommand {
    }

    record Decrement(String counterId, int amount) implements CounterCommand {
    }
}
