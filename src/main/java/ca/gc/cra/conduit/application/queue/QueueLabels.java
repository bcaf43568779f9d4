package ca.gc.cra.conduit.application.queue;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.LinkedHashMap;
import java.util.Map;

final class QueueLabels {
  private QueueLabels() {}

  static Map<String, String> of(String pipelineName, String component, QueueKey key) {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put(MetricNames.LABEL_PIPELINE_NAME, pipelineName);
    labels.put(MetricNames.LABEL_COMPONENT_NAME, component);
    labels.put(MetricNames.LABEL_QUEUE_TYPE, MetricNames.QUEUE_TYPE_BOUNDED);
    labels.put(MetricNames.LABEL_EXACTLY_ONCE, "false");
    labels.put(MetricNames.LABEL_REGION, key.region());
    labels.put(MetricNames.LABEL_PROJECT, key.project());
    labels.put(MetricNames.LABEL_LOGSTORE, key.logstore());
    return labels;
  }
}
