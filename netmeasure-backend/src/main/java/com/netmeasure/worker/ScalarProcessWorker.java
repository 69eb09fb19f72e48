package com.netmeasure.worker;

/**
 * Runs a command and takes the last whitespace-separated word of its output as one number.
 */
public class ScalarProcessWorker extends ProcessWorker {

    public ScalarProcessWorker(WorkerContext context) {
        super(context);
    }

    @Override
    protected WorkerResult parse(String output, String error) {
        String trimmed = output == null ? "" : output.strip();
        if (trimmed.isEmpty()) {
            return WorkerResult.empty();
        }
        String[] words = trimmed.split("\\s+");
        return WorkerResult.scalar(Double.parseDouble(words[words.length - 1]));
    }
}
