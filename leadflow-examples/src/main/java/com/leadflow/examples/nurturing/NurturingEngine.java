package com.leadflow.examples.nurturing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.model.RetryPolicy;
import com.leadflow.core.model.SegmentDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.rule.FieldResolver;
import com.leadflow.core.rule.RuleEvaluator;
import com.leadflow.core.rule.RuleValidator;
import com.leadflow.engine.cache.DefinitionCache;
import com.leadflow.engine.coordinator.ActionDispatcher;
import com.leadflow.engine.coordinator.ExecutionStateMachine;
import com.leadflow.engine.coordinator.StepScheduler;
import com.leadflow.engine.coordinator.TriggerMatcher;
import com.leadflow.engine.coordinator.WorkflowDefinitionService;
import com.leadflow.engine.history.ExecutionEventRecorder;
import com.leadflow.engine.history.ExecutionHistoryService;
import com.leadflow.engine.metrics.WorkflowMetrics;
import com.leadflow.engine.persistence.InMemoryExecutionEventRepository;
import com.leadflow.engine.persistence.InMemoryExecutionInstanceRepository;
import com.leadflow.engine.persistence.InMemorySegmentMembershipRepository;
import com.leadflow.engine.persistence.InMemorySegmentRepository;
import com.leadflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.leadflow.engine.segment.SegmentEvaluator;
import com.leadflow.scheduler.InMemoryTimerRepository;
import com.leadflow.scheduler.PollingTimerService;
import com.leadflow.worker.ActionHandlerRegistry;
import com.leadflow.worker.WebhookActionHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The whole engine over in-memory stores and a simulated clock.
 *
 * Timers are polled by {@link #advance(Duration)} rather than a background
 * thread, so a run is reproducible step by step.
 */
public class NurturingEngine {

    private static final Logger log = LoggerFactory.getLogger(NurturingEngine.class);

    public static final Instant DEMO_START = Instant.parse("2024-06-03T09:00:00Z");

    private final SimulatedClock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private final InMemoryLeadStore leads;
    private final NurturingActionHandlers actions;
    private final InMemoryExecutionInstanceRepository instanceRepository = new InMemoryExecutionInstanceRepository();
    private final PollingTimerService timerService;
    private final WorkflowDefinitionService definitions;
    private final TriggerMatcher triggerMatcher;
    private final ExecutionStateMachine stateMachine;
    private final SegmentEvaluator segments;
    private final ExecutionHistoryService history;

    public NurturingEngine() {
        this(new SimulatedClock(DEMO_START));
    }

    public NurturingEngine(SimulatedClock clock) {
        this.clock = clock;
        this.leads = new InMemoryLeadStore(clock);
        this.actions = new NurturingActionHandlers(leads, clock);

        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);

        InMemoryWorkflowDefinitionRepository definitionRepository = new InMemoryWorkflowDefinitionRepository();
        InMemorySegmentRepository segmentRepository = new InMemorySegmentRepository();
        InMemoryExecutionEventRepository eventRepository = new InMemoryExecutionEventRepository();
        DefinitionCache cache = new DefinitionCache(definitionRepository, segmentRepository);
        cache.bindMetrics(meterRegistry);

        FieldResolver fieldResolver = LeadSchema.fieldResolver();
        RuleEvaluator ruleEvaluator = new RuleEvaluator(fieldResolver);
        RuleValidator ruleValidator = new RuleValidator(LeadSchema.SCHEMA, fieldResolver);

        ActionHandlerRegistry handlers = actions.registerAll(ActionHandlerRegistry.withBuiltIns(),
            new WebhookActionHandler(Duration.ofSeconds(5), Duration.ofSeconds(10)));

        this.timerService = new PollingTimerService(new InMemoryTimerRepository(), clock);
        ExecutionEventRecorder recorder = new ExecutionEventRecorder(eventRepository, objectMapper, clock);
        StepScheduler stepScheduler = new StepScheduler(instanceRepository, timerService, recorder, metrics, clock);
        timerService.setListener(stepScheduler);

        this.stateMachine = new ExecutionStateMachine(cache, instanceRepository, recorder,
            new ActionDispatcher(handlers, metrics), stepScheduler, leads, ruleEvaluator, metrics, objectMapper, clock);
        this.triggerMatcher = new TriggerMatcher(cache, instanceRepository, leads, ruleEvaluator,
            stateMachine, metrics, clock);
        this.definitions = new WorkflowDefinitionService(definitionRepository, cache, ruleValidator, handlers, clock);
        this.segments = new SegmentEvaluator(segmentRepository, new InMemorySegmentMembershipRepository(), cache,
            leads, leads, ruleEvaluator, ruleValidator, metrics, clock);
        this.history = new ExecutionHistoryService(eventRepository, instanceRepository, clock);
    }

    /**
     * Publish the predefined workflows and define the predefined segments.
     */
    public List<WorkflowDefinition> installDefaults(RetryPolicy retryPolicy) {
        List<WorkflowDefinition> published = new ArrayList<>();
        for (WorkflowDefinition draft : NurturingWorkflows.all(retryPolicy)) {
            published.add(definitions.publish(draft));
        }
        for (SegmentDefinition segment : NurturingSegments.all()) {
            segments.define(segment);
        }
        log.info("Installed {} workflows and {} segments", published.size(), NurturingSegments.all().size());
        return published;
    }

    // ========== Lead Events ==========

    public List<UUID> leadCreated(String leadId, Map<String, Object> attributes) {
        leads.save(leadId, attributes);
        return triggerMatcher.onTrigger(NurturingWorkflows.LEAD_CREATED, leadId, null);
    }

    /**
     * Change a lead's score and fire {@code score_change}.
     */
    public List<UUID> scoreChanged(String leadId, int newScore) {
        Object previous = leads.attribute(leadId, LeadSchema.SCORE);
        leads.update(leadId, lead -> lead.put(LeadSchema.SCORE, newScore));
        JsonNode payload = objectMapper.createObjectNode()
            .put("from", previous instanceof Number number ? number.intValue() : 0)
            .put("to", newScore);
        return triggerMatcher.onTrigger(NurturingWorkflows.SCORE_CHANGED, leadId, payload);
    }

    public List<UUID> formSubmitted(String leadId, String form) {
        leads.update(leadId, lead -> lead.put(LeadSchema.LAST_ACTIVITY_AT, clock.instant()));
        JsonNode payload = objectMapper.createObjectNode().put("form", form);
        return triggerMatcher.onTrigger(NurturingWorkflows.FORM_SUBMITTED, leadId, payload);
    }

    public List<UUID> checkInactive(String leadId) {
        return triggerMatcher.onTrigger(NurturingWorkflows.LEAD_INACTIVE, leadId, null);
    }

    /**
     * Move the simulated clock and fire every wake that came due.
     *
     * @return the number of wakes fired
     */
    public int advance(Duration duration) {
        clock.advance(duration);
        return timerService.pollDueTimers();
    }

    /**
     * Advance in steps so that wakes scheduled by earlier wakes also fire.
     */
    public int advanceInSteps(Duration total, Duration step) {
        int fired = 0;
        Duration elapsed = Duration.ZERO;
        while (elapsed.compareTo(total) < 0) {
            Duration next = step.compareTo(total.minus(elapsed)) < 0 ? step : total.minus(elapsed);
            fired += advance(next);
            elapsed = elapsed.plus(next);
        }
        return fired;
    }

    // ========== Accessors ==========

    public SimulatedClock clock() {
        return clock;
    }

    public InMemoryLeadStore leads() {
        return leads;
    }

    public NurturingActionHandlers actions() {
        return actions;
    }

    public WorkflowDefinitionService definitions() {
        return definitions;
    }

    public TriggerMatcher triggerMatcher() {
        return triggerMatcher;
    }

    public ExecutionStateMachine stateMachine() {
        return stateMachine;
    }

    public SegmentEvaluator segments() {
        return segments;
    }

    public ExecutionHistoryService history() {
        return history;
    }

    public InMemoryExecutionInstanceRepository executions() {
        return instanceRepository;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }
}
