package com.edsim.triage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * FlowchartSelector - picks the flowchart for a chief complaint.
 *
 * Keywords match the lower-cased complaint at the start of a word (so "ear"
 * does not fire on "heart", while "diabet" still catches "diabetic"); the
 * longest matching keyword wins, and earlier table entries win ties. Complaints that
 * match nothing use {@value #DEFAULT_FLOWCHART}.
 */
public final class FlowchartSelector {

    public static final String DEFAULT_FLOWCHART = "unwell_adult";

    private final Map<String, Flowchart> flowcharts;
    private final Flowchart fallback;

    public FlowchartSelector(List<Flowchart> table, String defaultName) {
        Map<String, Flowchart> byName = new LinkedHashMap<>();
        for (Flowchart flowchart : table) {
            if (byName.put(flowchart.name, flowchart) != null) {
                throw new IllegalArgumentException("Duplicate flowchart '" + flowchart.name + "'");
            }
        }
        this.flowcharts = Collections.unmodifiableMap(byName);
        this.fallback = byName.get(defaultName);
        if (fallback == null) {
            throw new IllegalArgumentException("Default flowchart '" + defaultName + "' is not in the table");
        }
    }

    public static FlowchartSelector standard() {
        return new FlowchartSelector(standardTable(), DEFAULT_FLOWCHART);
    }

    public Flowchart select(String complaint) {
        if (complaint == null || complaint.isBlank()) {
            return fallback;
        }
        String text = complaint.toLowerCase(Locale.ROOT).replace('_', ' ');

        Flowchart best = null;
        int bestLength = 0;
        for (Flowchart flowchart : flowcharts.values()) {
            for (String keyword : flowchart.keywords) {
                if (keyword.length() > bestLength && startsWord(text, keyword)) {
                    best = flowchart;
                    bestLength = keyword.length();
                }
            }
        }
        return best != null ? best : fallback;
    }

    private static boolean startsWord(String text, String keyword) {
        int from = 0;
        while (true) {
            int at = text.indexOf(keyword, from);
            if (at < 0) {
                return false;
            }
            if (at == 0 || !Character.isLetterOrDigit(text.charAt(at - 1))) {
                return true;
            }
            from = at + 1;
        }
    }

    public Flowchart byName(String name) {
        return flowcharts.getOrDefault(name, fallback);
    }

    public Flowchart defaultFlowchart() {
        return fallback;
    }

    public List<String> names() {
        return new ArrayList<>(flowcharts.keySet());
    }

    public int size() {
        return flowcharts.size();
    }

    // ========== STANDARD TABLE ==========

    static List<Flowchart> standardTable() {
        List<Flowchart> table = new ArrayList<>();

        // respiratory
        add(table, "shortness_of_breath", "respiratory",
            List.of("difficulty_breathing", "wheeze", "unable_to_speak", "cyanosis", "exhaustion"),
            "shortness of breath", "difficulty breathing", "breathless", "breathing difficulty", "short of breath");
        add(table, "shortness_of_breath_child", "respiratory",
            List.of("very_low_pefr", "exhaustion", "significant_respiratory_history", "acute_onset_after_injury", "low_sao2"),
            "child breathing", "child shortness of breath", "baby breathing", "bronchiolitis");
        add(table, "cough", "respiratory",
            List.of("productive_cough", "blood_in_sputum", "chest_pain", "fever", "night_sweats"),
            "cough", "haemoptysis", "coughing");
        add(table, "asthma", "respiratory",
            List.of("peak_flow", "wheeze", "speech_difficulty", "accessory_muscles", "cyanosis"),
            "asthma", "wheez", "copd");

        // cardiovascular
        add(table, "chest_pain", "cardiovascular",
            List.of("severe_pain", "crushing_sensation", "radiation", "breathless", "sweating"),
            "chest pain", "chest tightness", "angina", "heart attack");
        add(table, "palpitations", "cardiovascular",
            List.of("irregular_pulse", "chest_discomfort", "dizziness", "syncope", "breathlessness"),
            "palpitation", "racing heart", "irregular heartbeat", "fast heart");
        add(table, "cardiac_arrest", "cardiovascular",
            List.of("unconscious", "no_pulse", "not_breathing", "cyanosis", "collapse"),
            "cardiac arrest", "no pulse", "not breathing", "resuscitation");

        // neurological
        add(table, "headache", "neurological",
            List.of("pain_severity", "sudden_onset", "neck_stiffness", "photophobia", "confusion"),
            "headache", "migraine", "head pain");
        add(table, "confusion", "neurological",
            List.of("altered_consciousness", "disorientation", "agitation", "memory_loss", "speech_problems"),
            "confusion", "confused", "disorientated", "delirium");
        add(table, "fits", "neurological",
            List.of("active_seizure", "post_ictal", "tongue_biting", "incontinence", "injury_during_fit"),
            "seizure", "fit", "convulsion", "epilep");
        add(table, "stroke", "neurological",
            List.of("facial_droop", "arm_weakness", "speech_problems", "sudden_onset", "headache"),
            "stroke", "facial droop", "slurred speech", "one sided weakness");
        add(table, "unconscious_adult", "neurological",
            List.of("gcs_score", "response_to_pain", "pupil_reaction", "breathing_pattern", "pulse_quality"),
            "unconscious", "unresponsive", "collapsed");
        add(table, "dizziness", "neurological",
            List.of("vertigo", "syncope", "unsteadiness", "vomiting", "headache"),
            "dizz", "vertigo", "light headed", "faint");

        // gastrointestinal
        add(table, "abdominal_pain", "gastrointestinal",
            List.of("pain_intensity", "vomiting", "rigidity", "distension", "tenderness"),
            "abdominal pain", "stomach pain", "tummy pain", "belly pain", "abdomen");
        add(table, "vomiting", "gastrointestinal",
            List.of("blood_in_vomit", "dehydration", "abdominal_pain", "bile_stained", "projectile"),
            "vomit", "nausea");
        add(table, "diarrhoea", "gastrointestinal",
            List.of("blood_in_stool", "dehydration", "cramping", "fever", "mucus"),
            "diarrhoea", "diarrhea", "loose stool");
        add(table, "gi_bleeding", "gastrointestinal",
            List.of("haematemesis", "melaena", "shock", "pallor", "weakness"),
            "gi bleed", "rectal bleeding", "vomiting blood", "black stool", "melaena");

        // trauma
        add(table, "limb_injuries", "trauma",
            List.of("deformity", "pain", "swelling", "loss_of_function", "bleeding"),
            "limb injury", "fracture", "broken", "sprain", "arm injury", "leg injury", "ankle", "wrist");
        add(table, "head_injury", "trauma",
            List.of("loss_of_consciousness", "confusion", "vomiting", "headache", "amnesia"),
            "head injury", "hit head", "concussion", "head trauma");
        add(table, "neck_injury", "trauma",
            List.of("neck_pain", "neurological_deficit", "mechanism_of_injury", "tenderness", "deformity"),
            "neck injury", "whiplash", "neck pain");
        add(table, "back_injury", "trauma",
            List.of("back_pain", "leg_weakness", "numbness", "bladder_problems", "mechanism"),
            "back injury", "back pain", "lower back");
        add(table, "burns", "trauma",
            List.of("burn_area", "depth", "airway_involvement", "pain", "blistering"),
            "burn", "scald");
        add(table, "wounds", "trauma",
            List.of("bleeding", "depth", "contamination", "pain", "location"),
            "wound", "laceration", "cut", "stab");
        add(table, "major_trauma", "trauma",
            List.of("mechanism_of_injury", "shock", "airway_compromise", "external_haemorrhage", "altered_consciousness"),
            "major trauma", "road traffic", "car accident", "motorcycle", "fall from height");
        add(table, "falls", "trauma",
            List.of("pain", "deformity", "loss_of_consciousness", "unable_to_stand", "head_injury"),
            "fall", "fell", "tripped");
        add(table, "assault", "trauma",
            List.of("head_injury", "bleeding", "pain", "loss_of_consciousness", "safeguarding_concern"),
            "assault", "attacked", "punched", "beaten");
        add(table, "chest_injury", "trauma",
            List.of("pain", "breathless", "chest_deformity", "bleeding", "shock"),
            "chest injury", "rib", "chest trauma");
        add(table, "torso_injury", "trauma",
            List.of("pain", "bruising", "shock", "abdominal_tenderness", "bleeding"),
            "torso injury", "abdominal injury", "blunt trauma");
        add(table, "facial_problems", "trauma",
            List.of("swelling", "pain", "deformity", "bleeding", "visual_disturbance"),
            "facial injury", "face injury", "broken nose", "jaw");
        add(table, "bites_and_stings", "trauma",
            List.of("pain", "swelling", "bleeding", "allergic_reaction", "infection_signs"),
            "bite", "sting", "bitten");
        add(table, "foreign_body", "trauma",
            List.of("pain", "obstruction", "bleeding", "swallowing_difficulty", "breathing_difficulty"),
            "foreign body", "swallowed", "object stuck");

        // genitourinary and obstetric
        add(table, "urinary_problems", "genitourinary",
            List.of("dysuria", "frequency", "urgency", "haematuria", "retention"),
            "urinary", "urine", "dysuria", "retention", "uti");
        add(table, "renal_colic", "genitourinary",
            List.of("loin_pain", "haematuria", "nausea", "restlessness", "radiation"),
            "renal colic", "kidney stone", "loin pain", "flank pain");
        add(table, "testicular_pain", "genitourinary",
            List.of("pain", "swelling", "sudden_onset", "vomiting", "fever"),
            "testicular", "scrotal", "groin pain");
        add(table, "sexually_acquired_infection", "genitourinary",
            List.of("discharge", "pain", "fever", "rash", "ulceration"),
            "sexually transmitted", "std", "genital");
        add(table, "pregnancy_problems", "obstetric",
            List.of("bleeding", "pain", "contractions", "fetal_movements", "blood_pressure"),
            "pregnan", "labour", "contractions");
        add(table, "vaginal_bleeding", "obstetric",
            List.of("amount", "pain", "pregnancy_test", "clots", "shock"),
            "vaginal bleeding", "pv bleed", "miscarriage");

        // paediatric
        add(table, "crying_baby", "paediatric",
            List.of("inconsolable", "fever", "feeding_problems", "rash", "lethargy"),
            "crying baby", "inconsolable", "irritable baby");
        add(table, "child_fever", "paediatric",
            List.of("temperature", "rash", "neck_stiffness", "lethargy", "feeding"),
            "child fever", "child with fever", "baby fever", "febrile child");
        add(table, "child_vomiting", "paediatric",
            List.of("dehydration", "bile_stained", "blood", "lethargy", "abdominal_pain"),
            "child vomiting", "baby vomiting");
        add(table, "limping_child", "paediatric",
            List.of("pain", "fever", "unable_to_weight_bear", "swelling", "injury"),
            "limping", "limp");

        // mental health and toxicology
        add(table, "mental_illness", "mental_health",
            List.of("risk_to_self", "risk_to_others", "psychosis", "depression", "agitation"),
            "mental", "anxiety", "panic", "psychosis", "depress", "suicidal");
        add(table, "self_harm", "mental_health",
            List.of("risk_to_self", "bleeding", "overdose_risk", "intent", "agitation"),
            "self harm", "self-harm", "cutting");
        add(table, "overdose_poisoning", "toxicology",
            List.of("consciousness_level", "respiratory_depression", "cardiac_effects", "seizures", "antidote_available"),
            "overdose", "poison", "ingestion", "took too many");
        add(table, "apparently_drunk", "toxicology",
            List.of("consciousness_level", "head_injury", "vomiting", "hypoglycaemia_signs", "agitation"),
            "drunk", "intoxicated", "alcohol");

        // other presentations
        add(table, "rash", "dermatology",
            List.of("distribution", "fever", "itch", "blistering", "systemic_illness"),
            "rash", "hives", "skin");
        add(table, "eye_problems", "ophthalmology",
            List.of("pain", "vision_loss", "discharge", "photophobia", "injury"),
            "eye", "vision", "visual");
        add(table, "ear_problems", "ent",
            List.of("pain", "discharge", "hearing_loss", "dizziness", "fever"),
            "ear", "hearing");
        add(table, "sore_throat", "ent",
            List.of("pain", "difficulty_swallowing", "fever", "drooling", "stridor"),
            "sore throat", "throat", "tonsil", "cold symptoms");
        add(table, "dental_problems", "ent",
            List.of("pain", "swelling", "bleeding", "fever", "trismus"),
            "dental", "tooth", "toothache");
        add(table, "diabetes", "endocrine",
            List.of("blood_glucose", "ketones", "dehydration", "consciousness", "breathing"),
            "diabet", "hypoglyc", "hyperglyc", "blood sugar");
        add(table, "allergy", "immunology",
            List.of("rash", "swelling", "breathing_difficulty", "shock", "tongue_swelling"),
            "allerg", "anaphyla");
        add(table, "unwell_adult", "general",
            List.of("pain", "fever", "breathing_difficulty", "altered_consciousness", "dehydration"),
            "unwell", "malaise", "weakness", "fever", "joint pain", "tired");

        return table;
    }

    private static void add(List<Flowchart> table, String name, String group, List<String> symptoms,
                            String... keywords) {
        List<String> allKeywords = new ArrayList<>(List.of(keywords));
        allKeywords.add(name.replace('_', ' '));
        table.add(new Flowchart(name, group, symptoms, allKeywords));
    }
}
