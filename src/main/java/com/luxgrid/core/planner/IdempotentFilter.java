package com.luxgrid.core.planner;

import com.luxgrid.core.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.util.List;

/**
 * Drops jobs whose declared output already exists.
 *
 * <p>Existence alone counts as proof of a complete earlier run. Size, checksum
 * and timestamps are not checked, so a truncated artifact left behind by an
 * interrupted tool is treated as done.
 */
@Service
public class IdempotentFilter {

    private static final Logger log = LoggerFactory.getLogger(IdempotentFilter.class);

    public List<Job> filter(List<Job> jobs) {
        var pending = jobs.stream()
                .filter(job -> !Files.exists(job.output()))
                .toList();

        int skipped = jobs.size() - pending.size();
        if (skipped > 0) {
            log.info("Skipping {} of {} jobs with existing outputs", skipped, jobs.size());
        }
        return pending;
    }
}
