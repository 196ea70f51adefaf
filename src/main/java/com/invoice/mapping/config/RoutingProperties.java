package com.invoice.mapping.config;

import com.invoice.mapping.model.ProcessingPath;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "invoice.routing")
public class RoutingProperties {

    @Min(0) @Max(100)
    private double autoApproveThreshold = 95.0;

    @Min(0) @Max(100)
    private double quickReviewThreshold = 80.0;

    /**
     * Number of failing critical fields that forces MANUAL_REQUIRED.
     */
    @Min(1)
    private int criticalFailureLimit = 3;

    @NotEmpty
    private List<String> criticalFields = new ArrayList<>(List.of(
            "invoiceNumber", "invoiceDate", "totalAmount",
            "currency", "shipperName", "consigneeName"));

    private Map<ProcessingPath, Integer> basePriority = defaultBasePriority();

    @Min(0)
    private int ageBonusPerDay = 5;

    @Min(0)
    private int maxAgeBonus = 20;

    @Min(0)
    private int criticalFieldBonus = 5;

    public int basePriorityFor(ProcessingPath path) {
        return basePriority.getOrDefault(path, 0);
    }

    private static Map<ProcessingPath, Integer> defaultBasePriority() {
        Map<ProcessingPath, Integer> priorities = new EnumMap<>(ProcessingPath.class);
        priorities.put(ProcessingPath.AUTO_APPROVE, 0);
        priorities.put(ProcessingPath.QUICK_REVIEW, 40);
        priorities.put(ProcessingPath.FULL_REVIEW, 60);
        priorities.put(ProcessingPath.MANUAL_REQUIRED, 70);
        return priorities;
    }
}
