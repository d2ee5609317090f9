package dk.cloudcreate.essentials.fmodel.application.test_data;

public sealed interface CounterEvent {
    String counterId();

    record Incremented(String counterId, int amount) implements CounterEvent {
    }

    record Decremented(String counterId, int amount) implements CounterEvent {
    }
}
