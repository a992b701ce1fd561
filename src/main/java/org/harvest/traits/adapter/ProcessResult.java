package org.harvest.traits.adapter;

public record ProcessResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
