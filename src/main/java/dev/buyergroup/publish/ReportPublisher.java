package dev.buyergroup.publish;

import dev.buyergroup.model.Report;
import reactor.core.publisher.Mono;

/**
 * Hands a finished report to whatever stores or forwards it.
 */
public interface ReportPublisher {

    /**
     * Publish one report.
     *
     * @param report The report of a finished run, successful or not
     * @return Mono<Boolean> indicating success or failure
     */
    Mono<Boolean> publish(Report report);
}
