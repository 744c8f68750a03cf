package com.elis.analysis.tool;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ToolCatalog {

    private final ToolProperties properties;
    private final Map<String, ToolContract> contracts = new LinkedHashMap<>();

    public ToolCatalog(ToolProperties properties) {
        this.properties = properties;
        for (ToolContract contract : List.of(
                new PdfExtractorContract(), new WatermarkRemovalContract(), new TamperDetectionContract())) {
            contracts.put(contract.name(), contract);
        }
    }

    public ToolRef ref(String name) {
        contract(name);
        return new ToolRef(name, properties.images().getOrDefault(name, name + ":latest"));
    }

    public ToolContract contract(ToolRef tool) {
        return contract(tool.name());
    }

    public ToolContract contract(String name) {
        ToolContract contract = contracts.get(name);
        if (contract == null) {
            throw new IllegalArgumentException("Unknown tool: " + name);
        }
        return contract;
    }

    public List<ToolRef> tools() {
        return contracts.keySet().stream().map(this::ref).toList();
    }
}
