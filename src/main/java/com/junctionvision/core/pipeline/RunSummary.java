package com.junctionvision.core.pipeline;

public record RunSummary(long frames, int violations, int profileFailures, int sinkFailures, boolean stopped) {

    @Override
    public String toString() {
        return "frames=" + frames + " violations=" + violations
                + " profileFailures=" + profileFailures + " sinkFailures=" + sinkFailures
                + (stopped ? " (stopped)" : "");
    }
}
