package dk.cloudcreate.commandhandling;

/**
 * The precondition on stream existence that must hold for a command to be valid.<br>
 * It governs both how the history is read and which expected version is used when the new events are appended.
 */
public enum ExpectedState {
    /**
     * The stream may or may not exist. A missing stream is folded from the default state and the append
     * expects the version that was read (or no stream if it didn't exist)
     */
    Any,
    /**
     * The stream MUST NOT exist. The append expects that there's still no stream
     */
    New,
    /**
     * The stream MUST exist. The append expects the exact version that was read
     */
    Existing
}
