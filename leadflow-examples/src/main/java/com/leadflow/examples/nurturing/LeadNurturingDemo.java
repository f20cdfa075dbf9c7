package com.leadflow.examples.nurturing;

import com.leadflow.core.model.ExecutionInstance;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.core.model.SegmentRecalculation;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.engine.history.ExecutionHistoryService.TimelineEntry;
import com.leadflow.engine.history.ExecutionHistoryService.WorkflowStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Demonstration runner for the lead nurturing workflows.
 *
 * Shows:
 * 1. A welcome sequence spread over ten simulated days
 * 2. A guard skipping messages once the lead converts
 * 3. Hot lead hand-off with duplicate and cooldown protection
 * 4. A demo request riding out a message provider outage
 * 5. Dynamic segmentation and workflow statistics
 */
public class LeadNurturingDemo {

    private static final Logger log = LoggerFactory.getLogger(LeadNurturingDemo.class);

    static final RetryPolicy DEMO_RETRY_POLICY = RetryPolicy.builder()
        .initialBackoff(Duration.ofMinutes(1))
        .maxBackoff(Duration.ofMinutes(10))
        .backoffMultiplier(2.0)
        .jitterFactor(0.0)
        .build();

    private final NurturingEngine engine;

    public LeadNurturingDemo(NurturingEngine engine) {
        this.engine = engine;
    }

    public static void main(String[] args) {
        LeadNurturingDemo demo = new LeadNurturingDemo(new NurturingEngine());
        demo.engine.installDefaults(DEMO_RETRY_POLICY);

        banner("LEADFLOW - LEAD NURTURING DEMONSTRATION");

        demo.runScenario1_WelcomeSequence();
        demo.runScenario2_ConversionSkipsMessages();
        demo.runScenario3_HotLeadAlert();
        demo.runScenario4_ProviderOutage();
        demo.runScenario5_SegmentsAndStats();

        banner("ALL DEMONSTRATIONS COMPLETE");
    }

    /**
     * SCENARIO 1: a new lead receives the full welcome sequence.
     */
    public void runScenario1_WelcomeSequence() {
        scenario("SCENARIO 1: Welcome Sequence");

        List<UUID> started = engine.leadCreated("lead-ana", lead("Ana Torres", "ana@acme.io", 35, "web"));
        log.info("lead_created started {} execution(s)", started.size());

        engine.advanceInSteps(Duration.ofDays(11), Duration.ofDays(1));

        engine.actions().sentTo("lead-ana").forEach(message ->
            log.info("  {} {} '{}' at {}", message.messageId(), message.channel(), message.template(), message.sentAt()));
        printTimeline(started.get(0));
    }

    /**
     * SCENARIO 2: skip_if guards drop the rest of the sequence after conversion.
     */
    public void runScenario2_ConversionSkipsMessages() {
        scenario("SCENARIO 2: Conversion Mid-Sequence");

        UUID executionId = engine.leadCreated("lead-ben", lead("Ben Okafor", "ben@globex.com", 50, "ads")).get(0);
        engine.advance(Duration.ofDays(1));
        engine.leads().update("lead-ben", lead -> lead.put(LeadSchema.CONVERTED, true));
        log.info("lead-ben converted after one day");

        engine.advanceInSteps(Duration.ofDays(10), Duration.ofDays(1));

        ExecutionInstance execution = engine.stateMachine().getExecution(executionId);
        log.info("Execution {} is {} with {} messages sent; step outcomes: {}",
            executionId, execution.status(), engine.actions().sentTo("lead-ben").size(),
            execution.stepHistory().stream().map(record -> record.outcome().name()).toList());
    }

    /**
     * SCENARIO 3: a score jump alerts sales once per week.
     */
    public void runScenario3_HotLeadAlert() {
        scenario("SCENARIO 3: Hot Lead Alert");

        engine.leadCreated("lead-cara", lead("Cara Lind", "cara@initech.com", 60, "chatbot"));
        List<UUID> first = engine.scoreChanged("lead-cara", 82);
        List<UUID> second = engine.scoreChanged("lead-cara", 90);
        log.info("First score change started {}, second started {} (cooldown)", first.size(), second.size());

        engine.actions().tasks().forEach(task -> log.info("  task '{}' for {} due {}", task.title(), task.leadId(), task.dueAt()));
        engine.actions().notifications().forEach(n -> log.info("  {} notification: {}", n.channel(), n.message()));
        log.info("lead-cara tags: {}", engine.leads().attribute("lead-cara", LeadSchema.TAGS));
    }

    /**
     * SCENARIO 4: the confirmation email is retried with backoff.
     */
    public void runScenario4_ProviderOutage() {
        scenario("SCENARIO 4: Message Provider Outage");

        engine.leadCreated("lead-dev", lead("Dev Patel", "dev@umbrella.com", 30, "web"));
        engine.actions().failNextSends(2);
        UUID executionId = engine.formSubmitted("lead-dev", "demo_request").get(0);

        ExecutionInstance execution = engine.stateMachine().getExecution(executionId);
        log.info("After the first attempt: {} (retry {}), next wake at {}",
            execution.status(), execution.retryCountForCurrentStep(), execution.nextWakeAt());

        engine.advanceInSteps(Duration.ofMinutes(5), Duration.ofMinutes(1));
        execution = engine.stateMachine().getExecution(executionId);
        log.info("After the outage: {} at step {}, score now {}",
            execution.status(), execution.currentStepIndex(), engine.leads().attribute("lead-dev", LeadSchema.SCORE));

        engine.advance(Duration.ofDays(1));
        log.info("Demo follow-up finished as {}", engine.stateMachine().getExecution(executionId).status());
        printTimeline(executionId);
    }

    /**
     * SCENARIO 5: recalculate every segment and report per-workflow statistics.
     */
    public void runScenario5_SegmentsAndStats() {
        scenario("SCENARIO 5: Segments and Statistics");

        Map<String, Object> enterprise = lead("Eve Adams", "eve@megacorp.com", 78, "referral");
        enterprise.put(LeadSchema.COMPANY, "MegaCorp");
        enterprise.put(LeadSchema.COMPANY_SIZE, 2500);
        enterprise.put(LeadSchema.STATUS, "qualified");
        engine.leadCreated("lead-eve", enterprise);

        for (SegmentRecalculation result : engine.segments().recalculateAll()) {
            log.info("  {}: {} members (+{} / -{})",
                result.segmentId(), result.totalMembers(), result.added().size(), result.removed().size());
        }

        for (WorkflowDefinition definition : engine.definitions().activeDefinitions()) {
            WorkflowStats stats = engine.history().workflowStats(definition.id(), Duration.ofDays(30));
            log.info("  {}: {} executions, completion {}%, failure {}%",
                definition.id(), stats.totalExecutions(),
                Math.round(stats.completionRate() * 100), Math.round(stats.failureRate() * 100));
        }
    }

    // ========== Helpers ==========

    private void printTimeline(UUID executionId) {
        List<TimelineEntry> timeline = engine.history().timeline(executionId);
        log.info("Timeline of {} ({} events):", executionId, timeline.size());
        for (TimelineEntry entry : timeline) {
            log.info("  #{} {} {} step={} {}", entry.sequenceNumber(), entry.timestamp(),
                entry.eventType(), entry.stepIndex(), entry.summary());
        }
    }

    private Map<String, Object> lead(String name, String email, int score, String source) {
        Instant now = engine.clock().instant();
        Map<String, Object> attributes = new HashMap<>();
        attributes.put(LeadSchema.NAME, name);
        attributes.put(LeadSchema.EMAIL, email);
        attributes.put(LeadSchema.PHONE, "+1555" + Math.abs(email.hashCode() % 10_000_000));
        attributes.put(LeadSchema.SCORE, score);
        attributes.put(LeadSchema.SOURCE, source);
        attributes.put(LeadSchema.STATUS, "new");
        attributes.put(LeadSchema.CONVERTED, false);
        attributes.put(LeadSchema.TAGS, new ArrayList<>());
        attributes.put(LeadSchema.LAST_ACTIVITY_AT, now);
        attributes.put(LeadSchema.LAST_INTERACTION_AT, now);
        return attributes;
    }

    private static void scenario(String title) {
        log.info("");
        log.info("=======================================================================");
        log.info(title);
        log.info("=======================================================================");
    }

    private static void banner(String title) {
        log.info("");
        log.info("#######################################################################");
        log.info("#  {}", title);
        log.info("#######################################################################");
    }
}
