package dk.cloudcreate.essentials.fmodel.domain;

/**
 * Implemented by commands, events and states that know the identity (aka. stream-id) of the
 * decision making unit or projection they belong to
 */
public interface Identifier {
    String identifier();
}
