package com.mirrorgroups.insights.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class QueueStats {

    boolean running;

    List<String> currentJobs;

    int maxConcurrentJobs;

    Duration pollInterval;

    int maxRetries;

    Duration retryDelay;
}
