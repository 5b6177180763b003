package com.nodeguardian.rule;

import com.nodeguardian.config.RuleSourceConfig;
import com.nodeguardian.exception.ConfigException;
import com.nodeguardian.rule.DocumentReader.SourcedDocument;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Rule documents from a local directory, typically a mounted ConfigMap. */
@Component
@ConditionalOnProperty(name = "nodeguardian.rules.source", havingValue = "file", matchIfMissing = true)
public class FileRuleSource implements RuleSource {

    private final DocumentReader documentReader;
    private final RuleSourceConfig ruleSourceConfig;

    public FileRuleSource(DocumentReader documentReader, RuleSourceConfig ruleSourceConfig) {
        this.documentReader = documentReader;
        this.ruleSourceConfig = ruleSourceConfig;
    }

    @Override
    public List<SourcedDocument> listDocuments() {
        Path directory = Path.of(ruleSourceConfig.getPath());
        // an absent mount is an outage, not an empty rule set
        if (!Files.isDirectory(directory)) {
            throw new ConfigException("Rule directory " + directory + " does not exist");
        }
        return documentReader.readDirectory(directory);
    }

    @Override
    public String describe() {
        return "directory " + ruleSourceConfig.getPath();
    }
}
