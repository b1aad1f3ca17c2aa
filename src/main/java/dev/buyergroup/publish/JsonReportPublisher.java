package dev.buyergroup.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.buyergroup.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes reports as pretty-printed JSON into the report directory.
 * With no directory configured the JSON goes to the log instead.
 */
@Slf4j
@Service
public class JsonReportPublisher implements ReportPublisher {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final String reportDir;

    public JsonReportPublisher(ObjectMapper objectMapper, @Value("${engine.report-dir:}") String reportDir) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.reportDir = reportDir;
    }

    @Override
    public Mono<Boolean> publish(Report report) {
        return Mono.fromCallable(() -> {
            try {
                String json = objectMapper.writeValueAsString(report);
                if (reportDir == null || reportDir.isBlank()) {
                    log.info("Report for {}:\n{}", report.getCompanyName(), json);
                    return true;
                }

                Path dir = Path.of(reportDir);
                Files.createDirectories(dir);
                Path file = dir.resolve(fileName(report));
                Files.writeString(file, json);
                log.info("Report written to {}", file);
                return true;

            } catch (JsonProcessingException e) {
                log.error("Failed to serialize report for {}: {}", report.getCompanyName(), e.getMessage(), e);
                return false;
            } catch (IOException e) {
                log.error("Failed to write report to {}: {}", reportDir, e.getMessage(), e);
                return false;
            }
        });
    }

    String fileName(Report report) {
        String company = report.getCompanyName().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        String timestamp = report.getGeneratedAt() != null ? FILE_TIMESTAMP.format(report.getGeneratedAt()) : "undated";
        return company + "-" + report.getSellerProfile() + "-" + timestamp + ".json";
    }
}
