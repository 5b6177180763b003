package com.nodeguardian.action;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Removes annotation keys from the node. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoveAnnotationAction implements NodeAction {

    private List<String> annotations;

    @Override
    public void execute(ActionContext context) {
        if (annotations == null || annotations.isEmpty()) {
            return;
        }
        context.nodeControl().removeAnnotations(context.nodeName(), annotations);
    }

    @Override
    public String getTypeName() {
        return "removeAnnotation";
    }
}
