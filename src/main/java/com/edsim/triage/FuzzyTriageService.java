package com.edsim.triage;

import com.edsim.config.SimulationParameters;
import com.edsim.config.SimulationParameters.CategorySettings;
import com.edsim.fuzzy.FuzzyInferenceEngine;
import com.edsim.fuzzy.FuzzyResult;
import com.edsim.fuzzy.LinguisticConverter;
import com.edsim.fuzzy.SeverityTerm;
import com.edsim.patient.Patient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * FuzzyTriageService - fuzzy Manchester triage.
 *
 * complaint → flowchart → symptom severities → numeric inputs → fuzzy
 * inference → category. Confidence is the aggregated firing strength of the
 * chosen category; the consultation estimate is that category's configured
 * mean.
 */
public class FuzzyTriageService implements TriageService {

    public static final String NAME = "fuzzy-manchester";

    private static final Logger log = LoggerFactory.getLogger(FuzzyTriageService.class);

    private final FlowchartSelector flowchartSelector;
    private final SymptomSeverityPolicy severityPolicy;
    private final FuzzyInferenceEngine engine;
    private final Map<TriageCategory, CategorySettings> categories;
    private final TriageStatistics statistics = new TriageStatistics();

    public FuzzyTriageService(FlowchartSelector flowchartSelector, SymptomSeverityPolicy severityPolicy,
                              FuzzyInferenceEngine engine, Map<TriageCategory, CategorySettings> categories) {
        this.flowchartSelector = flowchartSelector;
        this.severityPolicy = severityPolicy;
        this.engine = engine;
        this.categories = new EnumMap<>(categories);
    }

    public static FuzzyTriageService create(SimulationParameters parameters) {
        return new FuzzyTriageService(FlowchartSelector.standard(), new VitalSignSeverityPolicy(),
            FuzzyInferenceEngine.standard(), parameters.categories);
    }

    @Override
    public TriageVerdict assess(Patient patient) {
        Flowchart flowchart = flowchartSelector.select(patient.complaint());
        List<SeverityTerm> severities = severityPolicy.assess(flowchart, patient);
        double[] inputs = LinguisticConverter.toNumeric(severities);

        TriageVerdict verdict = fromInputs(inputs, flowchart.name);
        log.debug("🩺 {} '{}' via {} {} → {}", patient.id(), patient.complaint(), flowchart.name, severities,
            verdict.category);
        return verdict;
    }

    /**
     * Verdict for an explicit numeric symptom vector (0-10 each, zero-padded to five).
     */
    public TriageVerdict assessSymptoms(double[] inputs, String flowchartName) {
        return fromInputs(inputs, flowchartName);
    }

    private TriageVerdict fromInputs(double[] inputs, String flowchartName) {
        FuzzyResult result = engine.infer(inputs);
        TriageCategory category = result.category();
        CategorySettings settings = categories.get(category);

        TriageVerdict verdict = new TriageVerdict(
            category,
            settings != null ? settings.targetWait : category.defaultTargetWait(),
            result.score(),
            flowchartName,
            result.strength(category),
            settings != null ? settings.consultationMean : 0.0,
            Arrays.copyOf(inputs, inputs.length),
            NAME);
        statistics.record(verdict);
        return verdict;
    }

    public TriageStatistics statistics() {
        return statistics;
    }

    public FlowchartSelector flowchartSelector() {
        return flowchartSelector;
    }

    @Override
    public String name() {
        return NAME;
    }
}
