package io.github.drompincen.opsledger.runtime.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Tokens of the jobs currently running in this process, by job id. */
@Component
public class CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CancellationRegistry.class);

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(String jobId) {
        return tokens.computeIfAbsent(jobId, CancellationToken::new);
    }

    public Optional<CancellationToken> find(String jobId) {
        return Optional.ofNullable(tokens.get(jobId));
    }

    public boolean cancel(String jobId, String reason) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) return false;
        token.cancel(reason);
        log.info("Cancellation signalled for job {}: {}", jobId, reason);
        return true;
    }

    public int cancelAll(Collection<String> jobIds, String reason) {
        int signalled = 0;
        for (String jobId : jobIds) {
            if (cancel(jobId, reason)) signalled++;
        }
        return signalled;
    }

    public void remove(String jobId) {
        tokens.remove(jobId);
    }
}
