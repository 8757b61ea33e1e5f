package com.di.retailetl.config;

import com.di.retailetl.clean.CleaningRules;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Cleaning switches bound from {@code retailetl.cleaning.*} and frozen into {@link CleaningRules}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "retailetl.cleaning")
public class CleaningProperties {

    @NotEmpty
    private List<String> cancellationPrefixes = new ArrayList<>(List.of("C"));

    private List<String> uppercaseColumns = new ArrayList<>(List.of("country", "currency"));

    /** BCP 47 tag of the locale used to read numbers such as {@code "2,50"}. */
    @NotBlank
    private String decimalLocale = "en-US";

    public CleaningRules toCleaningRules() {
        return CleaningRules.builder()
                .cancellationPrefixes(List.copyOf(cancellationPrefixes))
                .uppercaseColumns(new HashSet<>(uppercaseColumns))
                .decimalLocale(Locale.forLanguageTag(decimalLocale))
                .build();
    }
}
