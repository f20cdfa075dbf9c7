package com.leadflow.engine.coordinator;

import com.leadflow.core.exception.NotFoundException;
import com.leadflow.core.exception.RuleValidationException;
import com.leadflow.core.exception.WorkflowValidationException;
import com.leadflow.core.model.StepDefinition;
import com.leadflow.core.model.WorkflowDefinition;
import com.leadflow.core.repository.WorkflowDefinitionRepository;
import com.leadflow.core.rule.RuleValidator;
import com.leadflow.engine.cache.DefinitionCache;
import com.leadflow.worker.ActionHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Publishes and retires workflow definitions.
 *
 * Publishing assigns the next version under the workflow's name and makes it
 * the only active version. Earlier versions stay readable so that their
 * executions can finish.
 */
public class WorkflowDefinitionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionService.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final DefinitionCache definitionCache;
    private final RuleValidator ruleValidator;
    private final ActionHandlerRegistry handlerRegistry;
    private final Clock clock;

    public WorkflowDefinitionService(
            WorkflowDefinitionRepository definitionRepository,
            DefinitionCache definitionCache,
            RuleValidator ruleValidator,
            ActionHandlerRegistry handlerRegistry,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.definitionCache = definitionCache;
        this.ruleValidator = ruleValidator;
        this.handlerRegistry = handlerRegistry;
        this.clock = clock;
    }

    /**
     * Validate a draft and publish it as the next version of its workflow.
     *
     * @throws WorkflowValidationException if the draft is malformed
     * @throws RuleValidationException if an entry rule or skip_if rule is invalid
     */
    public synchronized WorkflowDefinition publish(WorkflowDefinition draft) {
        log.info("Publishing workflow: {}", draft.name());

        validate(draft);

        int nextVersion = definitionRepository.getNextVersion(draft.name());
        WorkflowDefinition published = draft.asVersion(nextVersion, clock.instant());

        for (WorkflowDefinition previous : definitionRepository.findVersions(draft.name())) {
            if (previous.active()) {
                definitionRepository.setActive(previous.id(), false);
                log.info("Deactivated previous version {}", previous.id());
            }
        }

        definitionRepository.save(published);
        definitionCache.invalidateDefinitions();

        log.info("Published workflow {} with {} steps on trigger {}",
            published.id(), published.stepCount(), published.triggerKind());
        return published;
    }

    /**
     * Stop a published version from accepting new entries. Its running
     * executions continue.
     */
    public synchronized void deactivate(String workflowId) {
        if (!definitionRepository.setActive(workflowId, false)) {
            throw new NotFoundException("WorkflowDefinition", workflowId);
        }
        definitionCache.invalidateDefinitions();
        log.info("Deactivated workflow {}", workflowId);
    }

    public WorkflowDefinition getDefinition(String workflowId) {
        return definitionRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowId));
    }

    public List<WorkflowDefinition> versions(String name) {
        return definitionRepository.findVersions(name);
    }

    public List<WorkflowDefinition> activeDefinitions() {
        return definitionRepository.findAllActive();
    }

    // ========== Internal Methods ==========

    private void validate(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new WorkflowValidationException("name", "cannot be empty");
        }
        if (definition.name().contains(":")) {
            throw new WorkflowValidationException("name", "cannot contain ':'");
        }
        if (definition.triggerKind() == null || definition.triggerKind().isBlank()) {
            throw new WorkflowValidationException("triggerKind", "cannot be empty");
        }
        if (definition.steps().isEmpty()) {
            throw new WorkflowValidationException("steps", "cannot be empty");
        }
        if (definition.maxConcurrentPerEntity() != 1) {
            throw new WorkflowValidationException("maxConcurrentPerEntity",
                "only one active execution per entity is supported");
        }
        if (definition.maxEntriesPerEntity() < 0) {
            throw new WorkflowValidationException("maxEntriesPerEntity", "must be >= 0");
        }
        if (definition.cooldown().isNegative()) {
            throw new WorkflowValidationException("cooldown", "must be >= 0");
        }

        ruleValidator.validate(definition.entryRules());

        for (int i = 0; i < definition.steps().size(); i++) {
            StepDefinition step = definition.steps().get(i);
            if (step.index() != i) {
                throw new WorkflowValidationException("steps",
                    "step at position " + i + " has index " + step.index());
            }
            if (!handlerRegistry.contains(step.actionKind())) {
                throw new WorkflowValidationException("steps[" + i + "].actionKind",
                    "no handler registered for '" + step.actionKind() + "'");
            }
            ruleValidator.validate(step.skipIf());
        }
    }
}
