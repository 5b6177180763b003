package com.nodeguardian.rule;

import com.nodeguardian.gateway.KubernetesApiClient;
import com.nodeguardian.gateway.KubernetesConfig;
import com.nodeguardian.rule.DocumentReader.SourcedDocument;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Rule documents from the cluster-scoped NodeGuardianRule custom resources. */
@Component
@ConditionalOnProperty(name = "nodeguardian.rules.source", havingValue = "kubernetes")
public class KubernetesRuleSource implements RuleSource {

    private final KubernetesApiClient kubernetesApiClient;
    private final KubernetesConfig kubernetesConfig;

    public KubernetesRuleSource(KubernetesApiClient kubernetesApiClient, KubernetesConfig kubernetesConfig) {
        this.kubernetesApiClient = kubernetesApiClient;
        this.kubernetesConfig = kubernetesConfig;
    }

    @Override
    public List<SourcedDocument> listDocuments() {
        return kubernetesApiClient.listRuleDocuments().stream()
                .map(item -> new SourcedDocument(describe() + "/" + RuleDocumentMapper.ruleName(item), item))
                .toList();
    }

    @Override
    public String describe() {
        return kubernetesConfig.getRulePlural() + "." + kubernetesConfig.getRuleGroup() + "/"
                + kubernetesConfig.getRuleVersion();
    }
}
