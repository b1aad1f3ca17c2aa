package dev.buyergroup;

import dev.buyergroup.service.InvalidSellerProfileException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class BuyerGroupApplication implements CommandLineRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(BuyerGroupApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            int status = pipelineRunner.execute(args);
            exitManager.exit(status);
        } catch (IllegalArgumentException | InvalidSellerProfileException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            log.error(PipelineRunner.USAGE);
            exitManager.exit(EXIT_USAGE);
        } catch (Exception e) {
            log.error("Buyer group engine failed: {}", e.getMessage(), e);
            exitManager.exit(EXIT_FAILED);
        }
    }
}
