package com.stealthradar.monitor.fetch;

import com.stealthradar.common.RetryPolicy;
import com.stealthradar.monitor.adapter.ChainClient;
import com.stealthradar.monitor.adapter.RawLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fetches logs for one contract/event/block-range with bounded retries. The last failure is propagated as
 * {@link FetchException}; interpreting repeated failure as a backoff signal is the scheduler's job.
 */
@Slf4j
@Component
public class LogFetcher {

    private final ChainClient chainClient;
    private final RetryPolicy retryPolicy;

    public LogFetcher(ChainClient chainClient, @Qualifier("logFetchRetryPolicy") RetryPolicy retryPolicy) {
        this.chainClient = chainClient;
        this.retryPolicy = retryPolicy;
    }

    public List<RawLog> fetch(String chain, String contractAddress, String eventTopic, long fromBlock, long toBlock) {
        RuntimeException lastException = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            try {
                return chainClient.getLogs(chain, contractAddress, eventTopic, fromBlock, toBlock);
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("getLogs attempt {}/{} failed on {} [{}-{}]: {}",
                        attempt, retryPolicy.getMaxAttempts(), chain, fromBlock, toBlock, e.getMessage());
                if (retryPolicy.hasAttemptAfter(attempt)) {
                    sleep(retryPolicy.delayMs(attempt), chain, contractAddress, fromBlock, toBlock, attempt);
                }
            }
        }
        throw new FetchException(chain, contractAddress, fromBlock, toBlock, retryPolicy.getMaxAttempts(), lastException);
    }

    private static void sleep(long delayMs, String chain, String contractAddress, long fromBlock, long toBlock, int attempt) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(chain, contractAddress, fromBlock, toBlock, attempt, e);
        }
    }
}
