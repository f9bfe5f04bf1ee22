package com.pandora.orchestrator.evidence;

import com.pandora.orchestrator.model.ConnectorWatermark;
import com.pandora.orchestrator.repository.ConnectorWatermarkRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Describes, for an evidence bundle, which connectors a workspace has synced.
 */
@Component
public class DataSourceCatalog {

    private final ConnectorWatermarkRepository watermarks;

    public DataSourceCatalog(ConnectorWatermarkRepository watermarks) {
        this.watermarks = watermarks;
    }

    /**
     * One descriptor per connector in {@code relevantSources}, in the given
     * order. Connectors never synced for the workspace are listed as disconnected.
     */
    @Transactional(readOnly = true)
    public List<DataSourceDescriptor> describe(String workspaceId, List<String> relevantSources) {
        Map<String, ConnectorWatermark> byConnector = watermarks
                .findByWorkspaceIdOrderByConnectorTypeAsc(workspaceId).stream()
                .collect(Collectors.toMap(ConnectorWatermark::getConnectorType, Function.identity()));

        List<DataSourceDescriptor> result = new ArrayList<>(relevantSources.size());
        for (String source : relevantSources) {
            ConnectorWatermark wm = byConnector.get(source);
            if (wm == null || wm.getLastSyncAt() == null) {
                result.add(DataSourceDescriptor.disconnected(source, "Not connected; no data from " + source + " was used"));
            } else {
                result.add(DataSourceDescriptor.connected(source, wm.getLastSyncAt(), wm.getRecordCount()));
            }
        }
        return result;
    }
}
