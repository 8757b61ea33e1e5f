package com.di.retailetl.config;

import com.di.retailetl.load.RunOptions;
import com.di.retailetl.load.plan.LoadMode;
import com.di.retailetl.util.DateFormatUtils;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;

/**
 * Pipeline settings bound from {@code retailetl.pipeline.*}.
 *
 * <pre>
 * retailetl:
 *   pipeline:
 *     input-file: data/online_retail.csv
 *     schema-file: classpath:retail_schema.yml
 *     mode: INCREMENTAL          # or FULL (full refresh)
 *     dry-run: false
 *     only-clean: false
 *     start-date: 2010-12-01     # optional, inclusive
 *     end-date: 2010-12-31       # optional, inclusive
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "retailetl.pipeline")
public class RetailEtlProperties {

    @NotBlank
    private String inputFile;

    @NotBlank
    private String schemaFile = "classpath:retail_schema.yml";

    @NotBlank
    private String targetTable = "transactions";

    @NotNull
    private LoadMode mode = LoadMode.INCREMENTAL;

    private boolean dryRun;
    private boolean onlyClean;
    private boolean runOnStartup = true;

    @NotBlank
    private String reportDir = "logs/reports";

    private char csvDelimiter = ',';

    private String startDate;
    private String endDate;

    public RunOptions toRunOptions() {
        LocalDateTime start = isSet(startDate) ? DateFormatUtils.parseDate(startDate).atStartOfDay() : null;
        LocalDateTime end = isSet(endDate) ? DateFormatUtils.parseDate(endDate).plusDays(1).atStartOfDay() : null;
        if (start != null && end != null && !start.isBefore(end)) {
            throw new IllegalArgumentException("retailetl.pipeline.start-date " + startDate
                    + " is after end-date " + endDate);
        }
        return new RunOptions(mode, dryRun, onlyClean, start, end);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
