package com.edsim;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.edsim.config.ScenarioCatalog;
import com.edsim.config.SimulationParameters;
import com.edsim.fuzzy.LinguisticConverter;
import com.edsim.messages.Messages.*;
import com.edsim.actors.SimulationSupervisor;
import com.edsim.metrics.RunSummary;
import com.edsim.triage.FlowchartSelector;
import com.edsim.triage.FuzzyTriageService;
import com.edsim.triage.TriageVerdict;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ED Triage Simulation - command line entry point.
 *
 * <pre>
 *   Main                      run every configured scenario and compare them
 *   Main baseline crisis      run the named scenarios
 *   Main --list               list configured scenarios
 *   Main --assess 8,8,0,0,0   triage one symptom vector (numbers or terms like severe)
 * </pre>
 */
public class Main {

    private static final Duration COMPARISON_TIMEOUT = Duration.ofMinutes(30);

    public static void main(String[] args) {
        ScenarioCatalog catalog = ScenarioCatalog.load();

        if (args.length > 0 && args[0].equals("--list")) {
            System.out.println("🏥 Configured scenarios: " + String.join(", ", catalog.names()));
            return;
        }
        if (args.length > 0 && args[0].equals("--assess")) {
            if (args.length < 2) {
                System.err.println("❌ Usage: --assess v1,v2,v3,v4,v5 [flowchart]");
                System.exit(2);
            }
            assess(args[1], args.length > 2 ? args[2] : FlowchartSelector.DEFAULT_FLOWCHART);
            return;
        }

        System.out.println("🏥 Initializing ED Triage Simulation...");
        ActorSystem<SupervisorCommand> system = ActorSystem.create(
            SimulationSupervisor.create(catalog),
            "EdTriageSimulation"
        );

        List<String> scenarios = Arrays.asList(args);
        System.out.println("⏳ Running " + (scenarios.isEmpty() ? "all scenarios " + catalog.names() : scenarios));

        CompletionStage<ScenarioComparison> comparison = AskPattern.ask(
            system,
            replyTo -> new CompareScenarios(scenarios, replyTo),
            COMPARISON_TIMEOUT,
            system.scheduler()
        );

        int exitCode = 0;
        try {
            ScenarioComparison result = comparison.toCompletableFuture()
                .get(COMPARISON_TIMEOUT.toMinutes(), TimeUnit.MINUTES);
            printComparison(result);
            exitCode = result.failures.isEmpty() ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = 1;
        } catch (ExecutionException | TimeoutException e) {
            System.err.println("❌ Scenario comparison failed: " + e.getMessage());
            exitCode = 1;
        } finally {
            System.out.println("🔄 Shutting down system...");
            system.terminate();
        }
        System.exit(exitCode);
    }

    private static void printComparison(ScenarioComparison result) {
        for (Map.Entry<String, RunSummary> entry : result.summaries.entrySet()) {
            System.out.println("\n🏥 ============================================");
            System.out.println("🏥 SCENARIO: " + entry.getKey().toUpperCase());
            System.out.println("🏥 ============================================");
            System.out.println(entry.getValue().report());
        }
        for (Map.Entry<String, String> failure : result.failures.entrySet()) {
            System.out.println("\n❌ " + failure.getKey() + ": " + failure.getValue());
        }

        if (result.summaries.size() > 1) {
            System.out.println("\n📊 ============================================");
            System.out.println("📊 COMPARISON");
            System.out.println("📊 ============================================");
            System.out.printf("%-14s %9s %11s %9s %8s %10s%n",
                "scenario", "arrivals", "mean wait", "in ED", "LWBS", ">4h");
            result.summaries.forEach((name, summary) -> System.out.printf("%-14s %9d %11.1f %9.1f %7.1f%% %9.1f%%%n",
                name,
                summary.totalArrivals,
                summary.consultationWaits.mean,
                summary.systemTimes.mean,
                summary.lwbsRate() * 100,
                summary.fourHourBreachRate() * 100));
        }
    }

    private static void assess(String vector, String flowchart) {
        double[] inputs = Arrays.stream(vector.split(","))
            .map(String::trim)
            .mapToDouble(Main::parseSeverity)
            .toArray();
        FuzzyTriageService service = FuzzyTriageService.create(SimulationParameters.load());
        TriageVerdict verdict = service.assessSymptoms(inputs, flowchart);

        System.out.println("\n🩺 Symptoms: " + Arrays.toString(inputs));
        System.out.println("🚦 Category: " + verdict.category + " (" + verdict.category.description() + ")");
        System.out.printf("📈 Score: %.3f | Confidence: %.2f | Target wait: %d min%n",
            verdict.score, verdict.confidence, verdict.targetWaitMinutes);
    }

    private static double parseSeverity(String token) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return LinguisticConverter.toNumeric(token);
        }
    }
}
