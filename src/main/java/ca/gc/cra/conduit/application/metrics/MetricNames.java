package ca.gc.cra.conduit.application.metrics;

/**
 * Label keys, label values, and metric names exported by pipeline components.
 * <p>Names match the collector's published metric surface so dashboards keep working.</p>
 *
 * @since 0.1.0
 */
public final class MetricNames {
  private MetricNames() {}

  // label keys
  public static final String LABEL_PIPELINE_NAME = "pipeline_name";
  public static final String LABEL_COMPONENT_NAME = "component_name";
  public static final String LABEL_RUNNER_NAME = "runner_name";
  public static final String LABEL_FLUSHER_PLUGIN_ID = "flusher_plugin_id";
  public static final String LABEL_QUEUE_TYPE = "queue_type";
  public static final String LABEL_EXACTLY_ONCE = "exactly_once_enabled";
  public static final String LABEL_REGION = "region";
  public static final String LABEL_PROJECT = "project";
  public static final String LABEL_LOGSTORE = "logstore";

  // label values
  public static final String COMPONENT_PROCESS_QUEUE = "process_queue";
  public static final String COMPONENT_SENDER_QUEUE = "sender_queue";
  public static final String COMPONENT_BATCHER = "batcher";
  public static final String COMPONENT_ROUTER = "router";
  public static final String COMPONENT_SERIALIZER = "serializer";
  public static final String COMPONENT_COMPRESSOR = "compressor";
  public static final String RUNNER_FLUSHER = "flusher_runner";
  public static final String RUNNER_PROCESSOR = "processor_runner";
  public static final String QUEUE_TYPE_BOUNDED = "bounded";

  // shared component counters
  public static final String IN_EVENTS_TOTAL = "in_events_total";
  public static final String IN_ITEMS_TOTAL = "in_items_total";
  public static final String IN_SIZE_BYTES = "in_size_bytes";
  public static final String OUT_EVENTS_TOTAL = "out_events_total";
  public static final String OUT_ITEMS_TOTAL = "out_items_total";
  public static final String OUT_SIZE_BYTES = "out_size_bytes";
  public static final String TOTAL_DELAY_MS = "total_delay_ms";
  public static final String DISCARDED_ITEMS_TOTAL = "discarded_items_total";
  public static final String DISCARDED_EVENTS_TOTAL = "discarded_events_total";
  public static final String DISCARDED_SIZE_BYTES = "discarded_size_bytes";

  // queues
  public static final String QUEUE_SIZE = "queue_size";
  public static final String QUEUE_SIZE_BYTES = "queue_size_bytes";
  public static final String QUEUE_VALID_TO_PUSH = "valid_to_push_status";
  public static final String QUEUE_EXTRA_BUFFER_SIZE = "extra_buffer_size";
  public static final String QUEUE_EXTRA_BUFFER_SIZE_BYTES = "extra_buffer_size_bytes";
  public static final String FETCH_TIMES_TOTAL = "fetch_times_total";
  public static final String FETCHED_ITEMS_TOTAL = "fetched_items_total";
  public static final String FETCH_REJECTED_BY_GLOBAL_LIMITER = "fetch_rejected_by_global_limiter_times_total";
  public static final String FETCH_REJECTED_BY_REGION_LIMITER = "fetch_rejected_by_region_limiter_times_total";
  public static final String FETCH_REJECTED_BY_PROJECT_LIMITER = "fetch_rejected_by_project_limiter_times_total";
  public static final String FETCH_REJECTED_BY_LOGSTORE_LIMITER = "fetch_rejected_by_logstore_limiter_times_total";

  // batcher
  public static final String BATCHER_EVENT_BATCHES_TOTAL = "event_batches_total";
  public static final String BATCHER_BUFFERED_GROUPS = "buffered_groups_total";
  public static final String BATCHER_BUFFERED_EVENTS = "buffered_events_total";
  public static final String BATCHER_BUFFERED_SIZE_BYTES = "buffered_size_bytes";

  // compressor
  public static final String COMPRESS_FAIL_TOTAL = "compress_fail_total";

  // runners
  public static final String RUNNER_IN_EVENT_GROUPS_TOTAL = "in_event_groups_total";
  public static final String RUNNER_SINK_OUT_SUCCESSFUL_ITEMS = "sink_out_successful_items_total";
  public static final String RUNNER_SINK_OUT_FAILED_ITEMS = "sink_out_failed_items_total";
  public static final String RUNNER_SINK_OUT_FAILED_EVENTS = "sink_out_failed_events_total";
  public static final String RUNNER_SINK_SENDING_ITEMS = "sink_sending_items_total";
  public static final String RUNNER_SINK_SEND_CONCURRENCY = "send_concurrency";
  public static final String RUNNER_SEND_DONE_TOTAL = "send_done_total";
  public static final String RUNNER_RETRY_TIMES_TOTAL = "retry_times_total";
  public static final String RUNNER_CLIENT_REGISTER_STATE = "client_register_state";
  public static final String RUNNER_CLIENT_REGISTER_RETRY_TOTAL = "client_register_retry_total";
  public static final String RUNNER_SHARD_WRITE_QUOTA_ERROR = "shard_write_quota_error_total";
  public static final String RUNNER_PROJECT_QUOTA_ERROR = "project_quota_error_total";
  public static final String RUNNER_SEQUENCE_ID_ERROR = "sequence_id_error_total";
  public static final String RUNNER_REQUEST_EXPIRED_ERROR = "request_expired_error_total";

  // pipeline
  public static final String PIPELINE_REJECTED_SUBMITS = "rejected_submits_total";
  public static final String PIPELINE_START_TIME = "start_time";

  // MetricsPort histogram keys
  public static final String HISTOGRAM_SEND_LATENCY = "flusher.send.latencyMillis";
  public static final String HISTOGRAM_BATCH_AGE = "batcher.batch.ageMillis";
}
