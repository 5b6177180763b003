package com.nodeguardian.action;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Upserts annotations on the node. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnotationAction implements NodeAction {

    private Map<String, String> annotations;

    @Override
    public void execute(ActionContext context) {
        if (annotations == null || annotations.isEmpty()) {
            return;
        }
        context.nodeControl().annotate(context.nodeName(), annotations);
    }

    @Override
    public String getTypeName() {
        return "annotation";
    }
}
