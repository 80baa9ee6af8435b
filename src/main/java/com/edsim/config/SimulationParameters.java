package com.edsim.config;

import com.edsim.triage.TriageCategory;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SimulationParameters - immutable view of the {@code edsim} configuration block.
 *
 * Reading never validates; call {@link #validate()} before scheduling anything.
 */
public final class SimulationParameters {

    public static final String ROOT = "edsim";

    public final double duration;
    public final double warmUp;
    public final long seed;
    public final ArrivalSettings arrivals;
    public final ResourceSettings resources;
    public final TriageSettings triage;
    public final Map<TriageCategory, CategorySettings> categories;
    public final double minimumConsultation;
    public final double bedHandoverMean;
    public final double bedHandoverStd;
    public final double monitoringInterval;
    public final AbandonmentSettings abandonment;

    private SimulationParameters(Config config) {
        this.duration = config.getDouble("simulation.duration");
        this.warmUp = config.getDouble("simulation.warm-up");
        this.seed = config.getLong("simulation.seed");
        this.arrivals = new ArrivalSettings(config.getConfig("arrivals"), duration);
        this.resources = new ResourceSettings(config.getConfig("resources"));
        this.triage = new TriageSettings(config.getConfig("triage"));

        Map<TriageCategory, CategorySettings> byCategory = new EnumMap<>(TriageCategory.class);
        Config categoryConfig = config.getConfig("categories");
        for (TriageCategory category : TriageCategory.values()) {
            byCategory.put(category, new CategorySettings(category, categoryConfig.getConfig(category.name())));
        }
        this.categories = Collections.unmodifiableMap(byCategory);

        this.minimumConsultation = config.getDouble("consultation.minimum-duration");
        this.bedHandoverMean = config.getDouble("admission.bed-handover-mean");
        this.bedHandoverStd = config.getDouble("admission.bed-handover-std");
        this.monitoringInterval = config.getDouble("monitoring.interval");
        this.abandonment = new AbandonmentSettings(config.getConfig("abandonment"));
    }

    /**
     * Reads parameters from an {@code edsim} block, e.g. {@code root.getConfig("edsim")}.
     */
    public static SimulationParameters fromConfig(Config edsim) {
        try {
            return new SimulationParameters(edsim);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Cannot read simulation configuration: " + e.getMessage(), e);
        }
    }

    /** Parameters from {@code application.conf} plus system property overrides. */
    public static SimulationParameters load() {
        return fromConfig(ConfigFactory.load().getConfig(ROOT));
    }

    /**
     * Parameters with {@code overrides} (HOCON, relative to the {@code edsim} block) layered on top of the defaults.
     */
    public static SimulationParameters withOverrides(String overrides) {
        Config base = ConfigFactory.load().getConfig(ROOT);
        return fromConfig(ConfigFactory.parseString(overrides).withFallback(base).resolve());
    }

    public CategorySettings category(TriageCategory category) {
        return categories.get(category);
    }

    public double arrivalCutoff() {
        return arrivals.stopAfter;
    }

    /**
     * Every problem with these parameters; empty when they are usable.
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();
        if (duration <= 0) {
            errors.add("simulation.duration must be positive, got " + duration);
        }
        if (warmUp < 0) {
            errors.add("simulation.warm-up must not be negative, got " + warmUp);
        } else if (duration > 0 && warmUp >= duration) {
            errors.add("simulation.warm-up (" + warmUp + ") must be shorter than the duration (" + duration + ")");
        }

        arrivals.collectErrors(errors);
        resources.collectErrors(errors);
        triage.collectErrors(errors);

        int previousTarget = Integer.MIN_VALUE;
        for (TriageCategory category : TriageCategory.values()) {
            CategorySettings settings = categories.get(category);
            settings.collectErrors(errors);
            if (settings.targetWait < previousTarget) {
                errors.add("categories target waits must ascend with urgency, but " + category
                    + " (" + settings.targetWait + ") is below the previous category (" + previousTarget + ")");
            }
            previousTarget = settings.targetWait;
        }

        if (minimumConsultation <= 0) {
            errors.add("consultation.minimum-duration must be positive, got " + minimumConsultation);
        }
        if (bedHandoverMean <= 0 || bedHandoverStd < 0) {
            errors.add("admission bed handover needs mean > 0 and std >= 0, got "
                + bedHandoverMean + "/" + bedHandoverStd);
        }
        if (monitoringInterval <= 0) {
            errors.add("monitoring.interval must be positive, got " + monitoringInterval);
        }
        abandonment.collectErrors(errors);
        return errors;
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public SimulationParameters validate() {
        List<String> errors = validationErrors();
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format(
            "SimulationParameters{duration=%.0f, warmUp=%.0f, seed=%d, arrivals=%s, resources=%s, triage=%s, abandonment=%s}",
            duration, warmUp, seed, arrivals, resources, triage, abandonment);
    }

    // ========== NESTED SETTINGS ==========

    public static final class ArrivalSettings {
        public final double ratePerHour;
        public final String pattern;
        public final int peakStartHour;
        public final int peakEndHour;
        public final double peakMultiplier;
        public final double offPeakMultiplier;
        public final double stopAfter;

        ArrivalSettings(Config config, double duration) {
            this.ratePerHour = config.getDouble("rate-per-hour");
            this.pattern = config.getString("pattern").toLowerCase(Locale.ROOT);
            this.peakStartHour = config.getInt("peak-start-hour");
            this.peakEndHour = config.getInt("peak-end-hour");
            this.peakMultiplier = config.getDouble("peak-multiplier");
            this.offPeakMultiplier = config.getDouble("off-peak-multiplier");
            this.stopAfter = config.hasPath("stop-after") ? config.getDouble("stop-after") : duration;
        }

        public boolean isTimeOfDay() {
            return "time-of-day".equals(pattern);
        }

        void collectErrors(List<String> errors) {
            if (ratePerHour < 0 || Double.isNaN(ratePerHour)) {
                errors.add("arrivals.rate-per-hour must not be negative, got " + ratePerHour);
            }
            if (!"constant".equals(pattern) && !"time-of-day".equals(pattern)) {
                errors.add("arrivals.pattern must be 'constant' or 'time-of-day', got '" + pattern + "'");
            }
            if (peakStartHour < 0 || peakStartHour > 23 || peakEndHour < 1 || peakEndHour > 24
                || peakStartHour >= peakEndHour) {
                errors.add("arrivals peak hours must satisfy 0 <= start < end <= 24, got "
                    + peakStartHour + "-" + peakEndHour);
            }
            if (peakMultiplier < 0 || offPeakMultiplier < 0) {
                errors.add("arrivals multipliers must not be negative, got "
                    + peakMultiplier + "/" + offPeakMultiplier);
            }
            if (stopAfter < 0) {
                errors.add("arrivals.stop-after must not be negative, got " + stopAfter);
            }
        }

        @Override
        public String toString() {
            return String.format("{%.1f/h, %s}", ratePerHour, pattern);
        }
    }

    public static final class ResourceSettings {
        public final int triageNurses;
        public final int doctors;
        public final int cubicles;
        public final int admissionBeds;

        ResourceSettings(Config config) {
            this.triageNurses = config.getInt("triage-nurses");
            this.doctors = config.getInt("doctors");
            this.cubicles = config.getInt("cubicles");
            this.admissionBeds = config.getInt("admission-beds");
        }

        void collectErrors(List<String> errors) {
            requirePositive(errors, "resources.triage-nurses", triageNurses);
            requirePositive(errors, "resources.doctors", doctors);
            requirePositive(errors, "resources.cubicles", cubicles);
            requirePositive(errors, "resources.admission-beds", admissionBeds);
        }

        private static void requirePositive(List<String> errors, String path, int value) {
            if (value <= 0) {
                errors.add(path + " must be positive, got " + value);
            }
        }

        @Override
        public String toString() {
            return String.format("{nurses=%d, doctors=%d, cubicles=%d, beds=%d}",
                triageNurses, doctors, cubicles, admissionBeds);
        }
    }

    public static final class TriageSettings {
        public final String system;
        public final double assessmentMean;
        public final double assessmentStd;
        public final double assessmentMinimum;

        TriageSettings(Config config) {
            this.system = config.getString("system").toLowerCase(Locale.ROOT);
            this.assessmentMean = config.getDouble("assessment-mean");
            this.assessmentStd = config.getDouble("assessment-std");
            this.assessmentMinimum = config.getDouble("assessment-minimum");
        }

        void collectErrors(List<String> errors) {
            if (!"fuzzy".equals(system) && !"llm".equals(system)) {
                errors.add("triage.system must be 'fuzzy' or 'llm', got '" + system + "'");
            }
            if (assessmentMean <= 0 || assessmentStd < 0 || assessmentMinimum <= 0) {
                errors.add(String.format("triage assessment needs mean > 0, std >= 0, minimum > 0, got %s/%s/%s",
                    assessmentMean, assessmentStd, assessmentMinimum));
            }
        }

        @Override
        public String toString() {
            return String.format("{%s, assessment=%.1f±%.1f}", system, assessmentMean, assessmentStd);
        }
    }

    public static final class CategorySettings {
        public final TriageCategory category;
        public final int targetWait;
        public final double consultationMean;
        public final double consultationStd;
        public final double admissionProbability;

        CategorySettings(TriageCategory category, Config config) {
            this.category = category;
            this.targetWait = config.getInt("target-wait");
            this.consultationMean = config.getDouble("consultation-mean");
            this.consultationStd = config.getDouble("consultation-std");
            this.admissionProbability = config.getDouble("admission-probability");
        }

        void collectErrors(List<String> errors) {
            String prefix = "categories." + category.name();
            if (targetWait < 0) {
                errors.add(prefix + ".target-wait must not be negative, got " + targetWait);
            }
            if (consultationMean <= 0 || consultationStd < 0) {
                errors.add(prefix + " consultation needs mean > 0 and std >= 0, got "
                    + consultationMean + "/" + consultationStd);
            }
            if (admissionProbability < 0 || admissionProbability > 1 || Double.isNaN(admissionProbability)) {
                errors.add(prefix + ".admission-probability must lie in [0, 1], got " + admissionProbability);
            }
        }
    }

    public static final class AbandonmentSettings {
        public final String policy;
        public final double maxWait;
        public final double checkInterval;
        public final Set<TriageCategory> exemptCategories;

        AbandonmentSettings(Config config) {
            this.policy = config.getString("policy").toLowerCase(Locale.ROOT);
            this.maxWait = config.getDouble("max-wait");
            this.checkInterval = config.getDouble("check-interval");
            Set<TriageCategory> exempt = EnumSet.noneOf(TriageCategory.class);
            for (String name : config.getStringList("exempt-categories")) {
                exempt.add(TriageCategory.parse(name));
            }
            this.exemptCategories = Collections.unmodifiableSet(exempt);
        }

        public boolean isEnabled() {
            return !"none".equals(policy);
        }

        void collectErrors(List<String> errors) {
            if (!"timeout".equals(policy) && !"none".equals(policy)) {
                errors.add("abandonment.policy must be 'timeout' or 'none', got '" + policy + "'");
            }
            if (maxWait <= 0) {
                errors.add("abandonment.max-wait must be positive, got " + maxWait);
            }
            if (checkInterval <= 0) {
                errors.add("abandonment.check-interval must be positive, got " + checkInterval);
            }
        }

        @Override
        public String toString() {
            return String.format("{%s, max-wait=%.0f, exempt=%s}", policy, maxWait, exemptCategories);
        }
    }
}
