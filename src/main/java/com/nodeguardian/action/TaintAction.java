package com.nodeguardian.action;

import com.nodeguardian.domain.enums.TaintEffect;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Adds or replaces a taint on the node. Idempotent. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaintAction implements NodeAction {

    public static final String DEFAULT_KEY = "nodeguardian.io/status";
    public static final String DEFAULT_VALUE = "true";

    private String key;
    private String value;
    private TaintEffect effect;

    @Override
    public void execute(ActionContext context) {
        context.nodeControl().taint(context.nodeName(), effectiveKey(), effectiveValue(), effectiveEffect());
    }

    public String effectiveKey() {
        return key != null && !key.isBlank() ? key : DEFAULT_KEY;
    }

    public String effectiveValue() {
        return value != null ? value : DEFAULT_VALUE;
    }

    public TaintEffect effectiveEffect() {
        return effect != null ? effect : TaintEffect.NO_SCHEDULE;
    }

    @Override
    public String getTypeName() {
        return "taint";
    }
}
