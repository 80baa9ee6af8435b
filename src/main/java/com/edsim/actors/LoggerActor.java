package com.edsim.actors;

import akka.actor.typed.*;
import akka.actor.typed.javadsl.*;
import com.edsim.kernel.SimulationContext;
import com.edsim.messages.Messages.*;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * LoggerActor - centralized logging for scenario runs.
 * Receives fire-and-forget log events from the runner and supervisor actors.
 */
public class LoggerActor extends AbstractBehavior<LogCommand> {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    public static Behavior<LogCommand> create() {
        return Behaviors.setup(LoggerActor::new);
    }

    private LoggerActor(ActorContext<LogCommand> context) {
        super(context);
        getContext().getLog().info("📝 LoggerActor initialized");
    }

    @Override
    public Receive<LogCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LogEvent.class, this::onLogEvent)
                .build();
    }

    private Behavior<LogCommand> onLogEvent(LogEvent msg) {
        String logMessage = format(msg);
        switch (msg.level.toUpperCase()) {
            case "ERROR":
                getContext().getLog().error(logMessage);
                break;
            case "WARNING":
                getContext().getLog().warn(logMessage);
                break;
            case "DEBUG":
                getContext().getLog().debug(logMessage);
                break;
            case "CRITICAL":
                getContext().getLog().error("🚨 CRITICAL: {}", logMessage);
                break;
            default:
                getContext().getLog().info(logMessage);
        }
        return this;
    }

    static String format(LogEvent msg) {
        String timestamp = msg.timestamp.atZone(ZoneId.systemDefault()).format(TIMESTAMP_FORMAT);
        String level = msg.level.toUpperCase();
        String clock = msg.simulatedTime == null
            ? ""
            : " @ " + SimulationContext.formatClock(msg.simulatedTime);
        return String.format("[%s] %s %s | [%s] %s%s: %s",
            timestamp, emojiFor(level), level, msg.scenario, msg.source, clock, msg.event);
    }

    private static String emojiFor(String level) {
        return switch (level) {
            case "ERROR" -> "❌";
            case "WARNING" -> "⚠️";
            case "DEBUG" -> "🔍";
            case "CRITICAL" -> "🚨";
            default -> "ℹ️";
        };
    }
}
