package org.neuralchilli.irflow.core;

public class ProgramNotFoundException extends IrLookupException {

    private final String programId;

    public ProgramNotFoundException(String programId) {
        super("Program " + programId + " not found");
        this.programId = programId;
    }

    public String programId() {
        return programId;
    }
}
