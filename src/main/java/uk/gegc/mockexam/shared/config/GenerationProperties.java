package uk.gegc.mockexam.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning knobs for question generation and parsing
 */
@Component
@ConfigurationProperties(prefix = "generation")
@Data
public class GenerationProperties {

    /**
     * Extra questions requested from the model to absorb parse and validation loss
     */
    private int safetyBuffer = 5;

    /**
     * Run subjects concurrently on the generation executor
     */
    private boolean parallel = true;

    /**
     * Minimum share of structurally valid questions accepted in strict mode
     */
    private double minParseSuccessRate = 0.8;

    /**
     * Blocks shorter than this are ignored by the fallback parsing strategy
     */
    private int fallbackMinBlockLength = 50;

    /**
     * Fallback blocks must carry at least this many options
     */
    private int fallbackMinOptions = 3;
}
