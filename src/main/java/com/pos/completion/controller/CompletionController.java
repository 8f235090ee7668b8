package com.pos.completion.controller;

import com.pos.completion.model.AuditReport;
import com.pos.completion.model.CompletionResult;
import com.pos.completion.model.CompletionSnapshot;
import com.pos.completion.model.IdentityDecision;
import com.pos.completion.model.IdentityProbeRequest;
import com.pos.completion.model.TimelineDay;
import com.pos.completion.service.CompletionEngine;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

/**
 * REST controller exposing the completion engine.
 *
 * Base path: {@code /api/completion}
 *
 * The engine never fetches catalogs itself, so every request carries the full
 * input snapshot.
 *
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/completion/compute}   – compute completion for a snapshot</li>
 *   <li>{@code POST /api/completion/audit}     – compute and audit a snapshot</li>
 *   <li>{@code POST /api/completion/identity}  – resolve one submission against one store</li>
 *   <li>{@code POST /api/completion/timeline}  – daily survey activity of a snapshot</li>
 * </ul>
 */
@Controller("/api/completion")
public class CompletionController {

    private static final Logger log = LoggerFactory.getLogger(CompletionController.class);

    @Inject
    private CompletionEngine completionEngine;

    // -----------------------------------------------------------------------
    // POST /api/completion/compute
    // -----------------------------------------------------------------------

    /**
     * Computes per-store, per-model, per-region and global completion.
     *
     * @param snapshot displays, stores, requirements and submissions
     * @return HTTP 200 with the completion result
     */
    @Post("/compute")
    public CompletionResult compute(@Body CompletionSnapshot snapshot) {
        log.info("POST /compute displays={} submissions={}", snapshot.displays().size(), snapshot.submissions().size());
        return completionEngine.computeCompletion(
                snapshot.displays(), snapshot.submissions(), snapshot.requirements(), snapshot.stores());
    }

    // -----------------------------------------------------------------------
    // POST /api/completion/audit
    // -----------------------------------------------------------------------

    /**
     * Computes completion for the snapshot and returns its audit report.
     *
     * @param snapshot displays, stores, requirements and submissions
     * @return HTTP 200 with the audit report
     */
    @Post("/audit")
    public AuditReport audit(@Body CompletionSnapshot snapshot) {
        log.info("POST /audit displays={} submissions={}", snapshot.displays().size(), snapshot.submissions().size());
        CompletionResult result = completionEngine.computeCompletion(
                snapshot.displays(), snapshot.submissions(), snapshot.requirements(), snapshot.stores());
        return completionEngine.auditCompletion(result, snapshot.displays(), snapshot.submissions());
    }

    // -----------------------------------------------------------------------
    // POST /api/completion/identity
    // -----------------------------------------------------------------------

    /**
     * Resolves one submission's labels against one candidate store.
     *
     * Returns HTTP 400 when {@code candidateStoreId} is blank.
     *
     * @param request the validated probe
     * @return HTTP 200 with the identity decision
     */
    @Post("/identity")
    public IdentityDecision identity(@Body @Valid IdentityProbeRequest request) {
        log.info("POST /identity candidateStoreId={}", request.candidateStoreId());
        return completionEngine.resolveStoreIdentity(
                request.leaderLabel(), request.shopNameLabel(), request.candidateStoreId(), request.stores());
    }

    // -----------------------------------------------------------------------
    // POST /api/completion/timeline
    // -----------------------------------------------------------------------

    /**
     * Buckets the snapshot's submissions by calendar day.
     *
     * @param zone     time zone used to cut days (default UTC)
     * @param snapshot only {@code submissions} is read
     * @return HTTP 200 with the timeline, or HTTP 400 for an unknown zone
     */
    @Post("/timeline")
    public List<TimelineDay> timeline(@QueryValue(defaultValue = "UTC") String zone,
                                      @Body CompletionSnapshot snapshot) {
        log.info("POST /timeline zone={} submissions={}", zone, snapshot.submissions().size());
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.info("Rejected unknown zone={}", zone);
            throw new HttpStatusException(HttpStatus.BAD_REQUEST, "Unknown time zone: " + zone);
        }
        return completionEngine.timeline(snapshot.submissions(), zoneId);
    }
}
