package com.leadflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.leadflow.core.model.ActionResult;

/**
 * Built-in no-op action for steps that exist only to carry a delay.
 */
public class WaitActionHandler implements ActionHandler {
    
    public static final String KIND = "wait";
    
    @Override
    public ActionResult execute(JsonNode parameters, ActionContext context) {
        return ActionResult.succeeded();
    }
}
