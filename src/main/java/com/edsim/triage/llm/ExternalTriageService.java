package com.edsim.triage.llm;

import com.edsim.config.SimulationParameters.CategorySettings;
import com.edsim.patient.Patient;
import com.edsim.triage.TriageCategory;
import com.edsim.triage.TriageService;
import com.edsim.triage.TriageStatistics;
import com.edsim.triage.TriageVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ExternalTriageService - triage through an external client, with a fallback service when it fails.
 */
public class ExternalTriageService implements TriageService {

    public static final String FLOWCHART = "external";

    private static final Logger log = LoggerFactory.getLogger(ExternalTriageService.class);
    private static final Pattern DURATION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(h|hr|hrs|hour|hours|m|min|mins|minute|minutes)?");

    private final ExternalTriageClient client;
    private final TriageService fallback;
    private final Map<TriageCategory, CategorySettings> categories;
    private final TriageStatistics statistics = new TriageStatistics();
    private int fallbacks;

    public ExternalTriageService(ExternalTriageClient client, TriageService fallback,
                                 Map<TriageCategory, CategorySettings> categories) {
        this.client = client;
        this.fallback = fallback;
        this.categories = new EnumMap<>(categories);
    }

    @Override
    public TriageVerdict assess(Patient patient) {
        ExternalTriageAssessment assessment;
        try {
            assessment = client.assess(patient);
        } catch (ExternalTriageException e) {
            fallbacks++;
            log.warn("⚠️ External triage failed for {} ({}), using {}", patient.id(), e.getMessage(), fallback.name());
            return fallback.assess(patient);
        }

        TriageCategory category = assessment.category;
        CategorySettings settings = categories.get(category);
        int configuredTarget = settings != null ? settings.targetWait : category.defaultTargetWait();
        Integer parsedWait = parseWaitMinutes(assessment.waitTime);

        TriageVerdict verdict = new TriageVerdict(
            category,
            parsedWait != null ? parsedWait : configuredTarget,
            category.priority(),
            FLOWCHART,
            assessment.confidence,
            settings != null ? settings.consultationMean : 0.0,
            new double[0],
            name());
        statistics.record(verdict);
        return verdict;
    }

    /**
     * Minutes in a wait-time string such as "Immediate", "10 min", "within 1-2 hours" (lower bound),
     * or null when no duration can be read.
     */
    static Integer parseWaitMinutes(String waitTime) {
        if (waitTime == null || waitTime.isBlank()) {
            return null;
        }
        String text = waitTime.trim().toLowerCase(Locale.ROOT);
        if (text.startsWith("immediate") || text.equals("now")) {
            return 0;
        }
        Matcher matcher = DURATION.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);
        if (unit == null && text.contains("hour")) {
            unit = "h";
        }
        boolean hours = unit != null && unit.startsWith("h");
        return (int) Math.round(hours ? amount * 60 : amount);
    }

    public TriageStatistics statistics() {
        return statistics;
    }

    public int fallbackCount() {
        return fallbacks;
    }

    @Override
    public String name() {
        return "external-llm";
    }
}
