package com.leadflow.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadflow.core.port.TimerService;
import com.leadflow.core.repository.ExecutionEventRepository;
import com.leadflow.core.repository.ExecutionInstanceRepository;
import com.leadflow.core.repository.SegmentMembershipRepository;
import com.leadflow.core.repository.SegmentRepository;
import com.leadflow.core.repository.WorkflowDefinitionRepository;
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
import com.leadflow.engine.persistence.jdbc.DefinitionJsonCodec;
import com.leadflow.engine.persistence.jdbc.JdbcExecutionEventRepository;
import com.leadflow.engine.persistence.jdbc.JdbcExecutionInstanceRepository;
import com.leadflow.engine.persistence.jdbc.JdbcSegmentMembershipRepository;
import com.leadflow.engine.persistence.jdbc.JdbcSegmentRepository;
import com.leadflow.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.leadflow.engine.segment.SegmentEvaluator;
import com.leadflow.examples.nurturing.InMemoryLeadStore;
import com.leadflow.examples.nurturing.LeadSchema;
import com.leadflow.examples.nurturing.NurturingActionHandlers;
import com.leadflow.recovery.StuckExecutionMonitor;
import com.leadflow.scheduler.InMemoryTimerRepository;
import com.leadflow.scheduler.JdbcTimerRepository;
import com.leadflow.scheduler.PollingTimerService;
import com.leadflow.scheduler.TimerRepository;
import com.leadflow.worker.ActionHandlerRegistry;
import com.leadflow.worker.WebhookActionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the engine over either in-memory or PostgreSQL repositories.
 *
 * <p>{@code leadflow.persistence.mode} selects the repositories; everything
 * above them is shared. Lead data always comes from an {@link InMemoryLeadStore}.
 */
@Configuration
@EnableConfigurationProperties(LeadflowProperties.class)
public class EngineConfiguration {

    private static final String MODE_PREFIX = "leadflow.persistence";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "leadflow");
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);
        return metrics;
    }

    // ========== Repositories ==========

    @Configuration
    @ConditionalOnProperty(prefix = MODE_PREFIX, name = "mode", havingValue = "memory", matchIfMissing = true)
    static class InMemoryRepositories {

        @Bean
        public WorkflowDefinitionRepository workflowDefinitionRepository() {
            return new InMemoryWorkflowDefinitionRepository();
        }

        @Bean
        public ExecutionInstanceRepository executionInstanceRepository() {
            return new InMemoryExecutionInstanceRepository();
        }

        @Bean
        public ExecutionEventRepository executionEventRepository() {
            return new InMemoryExecutionEventRepository();
        }

        @Bean
        public SegmentRepository segmentRepository() {
            return new InMemorySegmentRepository();
        }

        @Bean
        public SegmentMembershipRepository segmentMembershipRepository() {
            return new InMemorySegmentMembershipRepository();
        }

        @Bean
        public TimerRepository timerRepository() {
            return new InMemoryTimerRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = MODE_PREFIX, name = "mode", havingValue = "jdbc")
    static class JdbcRepositories {

        @Bean
        public DefinitionJsonCodec definitionJsonCodec(ObjectMapper objectMapper) {
            return new DefinitionJsonCodec(objectMapper);
        }

        @Bean
        public WorkflowDefinitionRepository workflowDefinitionRepository(JdbcTemplate jdbcTemplate,
                                                                         DefinitionJsonCodec codec) {
            return new JdbcWorkflowDefinitionRepository(jdbcTemplate, codec);
        }

        @Bean
        public ExecutionInstanceRepository executionInstanceRepository(JdbcTemplate jdbcTemplate,
                                                                       DefinitionJsonCodec codec) {
            return new JdbcExecutionInstanceRepository(jdbcTemplate, codec);
        }

        @Bean
        public ExecutionEventRepository executionEventRepository(JdbcTemplate jdbcTemplate,
                                                                 DefinitionJsonCodec codec) {
            return new JdbcExecutionEventRepository(jdbcTemplate, codec);
        }

        @Bean
        public SegmentRepository segmentRepository(JdbcTemplate jdbcTemplate, DefinitionJsonCodec codec) {
            return new JdbcSegmentRepository(jdbcTemplate, codec);
        }

        @Bean
        public SegmentMembershipRepository segmentMembershipRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcSegmentMembershipRepository(jdbcTemplate);
        }

        @Bean
        public TimerRepository timerRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcTimerRepository(jdbcTemplate);
        }
    }

    // ========== Rules and Definitions ==========

    @Bean
    public DefinitionCache definitionCache(WorkflowDefinitionRepository definitionRepository,
                                           SegmentRepository segmentRepository,
                                           LeadflowProperties properties,
                                           MeterRegistry meterRegistry) {
        LeadflowProperties.Cache cache = properties.getCache();
        DefinitionCache definitionCache = new DefinitionCache(
            definitionRepository, segmentRepository, cache.getTtl(), cache.getMaxSize());
        definitionCache.bindMetrics(meterRegistry);
        return definitionCache;
    }

    @Bean
    public FieldResolver fieldResolver() {
        return LeadSchema.fieldResolver();
    }

    @Bean
    public RuleEvaluator ruleEvaluator(FieldResolver fieldResolver) {
        return new RuleEvaluator(fieldResolver);
    }

    @Bean
    public RuleValidator ruleValidator(FieldResolver fieldResolver) {
        return new RuleValidator(LeadSchema.SCHEMA, fieldResolver);
    }

    // ========== Leads and Actions ==========

    @Bean
    public InMemoryLeadStore leadStore(Clock clock) {
        return new InMemoryLeadStore(clock);
    }

    @Bean
    public NurturingActionHandlers nurturingActionHandlers(InMemoryLeadStore leadStore, Clock clock) {
        return new NurturingActionHandlers(leadStore, clock);
    }

    @Bean
    public ActionHandlerRegistry actionHandlerRegistry(NurturingActionHandlers actions,
                                                       LeadflowProperties properties) {
        LeadflowProperties.Webhook webhook = properties.getWebhook();
        return actions.registerAll(ActionHandlerRegistry.withBuiltIns(),
            new WebhookActionHandler(webhook.getConnectTimeout(), webhook.getRequestTimeout()));
    }

    @Bean
    public ActionDispatcher actionDispatcher(ActionHandlerRegistry registry, WorkflowMetrics metrics) {
        return new ActionDispatcher(registry, metrics);
    }

    // ========== Execution ==========

    @Bean
    public PollingTimerService timerService(TimerRepository timerRepository,
                                            Clock clock,
                                            LeadflowProperties properties) {
        LeadflowProperties.Timer timer = properties.getTimer();
        return new PollingTimerService(timerRepository, clock, timer.getPollInterval(), timer.getBatchSize());
    }

    @Bean
    public ExecutionEventRecorder executionEventRecorder(ExecutionEventRepository eventRepository,
                                                         ObjectMapper objectMapper,
                                                         Clock clock) {
        return new ExecutionEventRecorder(eventRepository, objectMapper, clock);
    }

    @Bean
    public StepScheduler stepScheduler(ExecutionInstanceRepository instanceRepository,
                                       TimerService timerService,
                                       ExecutionEventRecorder recorder,
                                       WorkflowMetrics metrics,
                                       Clock clock) {
        return new StepScheduler(instanceRepository, timerService, recorder, metrics, clock);
    }

    @Bean
    public ExecutionStateMachine executionStateMachine(DefinitionCache cache,
                                                       ExecutionInstanceRepository instanceRepository,
                                                       ExecutionEventRecorder recorder,
                                                       ActionDispatcher dispatcher,
                                                       StepScheduler stepScheduler,
                                                       InMemoryLeadStore leadStore,
                                                       RuleEvaluator ruleEvaluator,
                                                       WorkflowMetrics metrics,
                                                       ObjectMapper objectMapper,
                                                       Clock clock) {
        return new ExecutionStateMachine(cache, instanceRepository, recorder, dispatcher, stepScheduler,
            leadStore, ruleEvaluator, metrics, objectMapper, clock);
    }

    @Bean
    public TriggerMatcher triggerMatcher(DefinitionCache cache,
                                         ExecutionInstanceRepository instanceRepository,
                                         InMemoryLeadStore leadStore,
                                         RuleEvaluator ruleEvaluator,
                                         ExecutionStateMachine stateMachine,
                                         WorkflowMetrics metrics,
                                         Clock clock) {
        return new TriggerMatcher(cache, instanceRepository, leadStore, ruleEvaluator, stateMachine, metrics, clock);
    }

    @Bean
    public WorkflowDefinitionService workflowDefinitionService(WorkflowDefinitionRepository definitionRepository,
                                                               DefinitionCache cache,
                                                               RuleValidator ruleValidator,
                                                               ActionHandlerRegistry registry,
                                                               Clock clock) {
        return new WorkflowDefinitionService(definitionRepository, cache, ruleValidator, registry, clock);
    }

    @Bean
    public SegmentEvaluator segmentEvaluator(SegmentRepository segmentRepository,
                                             SegmentMembershipRepository membershipRepository,
                                             DefinitionCache cache,
                                             InMemoryLeadStore leadStore,
                                             RuleEvaluator ruleEvaluator,
                                             RuleValidator ruleValidator,
                                             WorkflowMetrics metrics,
                                             Clock clock) {
        return new SegmentEvaluator(segmentRepository, membershipRepository, cache, leadStore, leadStore,
            ruleEvaluator, ruleValidator, metrics, clock);
    }

    @Bean
    public ExecutionHistoryService executionHistoryService(ExecutionEventRepository eventRepository,
                                                           ExecutionInstanceRepository instanceRepository,
                                                           Clock clock) {
        return new ExecutionHistoryService(eventRepository, instanceRepository, clock);
    }

    @Bean
    public StuckExecutionMonitor stuckExecutionMonitor(ExecutionInstanceRepository instanceRepository,
                                                       ExecutionEventRecorder recorder,
                                                       TimerService timerService,
                                                       WorkflowMetrics metrics,
                                                       Clock clock,
                                                       LeadflowProperties properties) {
        LeadflowProperties.Recovery recovery = properties.getRecovery();
        return new StuckExecutionMonitor(instanceRepository, recorder, timerService, metrics, clock,
            recovery.getStuckThreshold(), recovery.getCheckInterval());
    }
}
