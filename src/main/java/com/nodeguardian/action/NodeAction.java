package com.nodeguardian.action;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One step of a trigger or recovery batch, executed against a single node.
 *
 * <p>Rule documents name the kind in a {@code type} property; the remaining properties are the
 * action's own fields. Implementations throw on failure and the
 * {@link ActionOrchestrator} isolates the failure from the rest of the batch.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TaintAction.class, name = "taint"),
    @JsonSubTypes.Type(value = UntaintAction.class, name = "untaint"),
    @JsonSubTypes.Type(value = LabelAction.class, name = "label"),
    @JsonSubTypes.Type(value = RemoveLabelAction.class, name = "removeLabel"),
    @JsonSubTypes.Type(value = AnnotationAction.class, name = "annotation"),
    @JsonSubTypes.Type(value = RemoveAnnotationAction.class, name = "removeAnnotation"),
    @JsonSubTypes.Type(value = EvictAction.class, name = "evict"),
    @JsonSubTypes.Type(value = AlertAction.class, name = "alert")
})
public interface NodeAction {

    void execute(ActionContext context);

    /** Short type name used in logs, metrics and batch results. */
    @JsonIgnore
    String getTypeName();
}
