package com.slack.netselect.netselect;

import java.util.List;

/**
 * Paths, protocol versions and parameter names of the internal select API spoken between select
 * and storage nodes. A version must be bumped every time the wire format of its endpoint changes;
 * both sides compare versions for exact equality.
 */
public final class InternalSelectProtocol {

  public static final String QUERY_PATH = "/internal/select/query";
  public static final String FIELD_NAMES_PATH = "/internal/select/field_names";
  public static final String FIELD_VALUES_PATH = "/internal/select/field_values";
  public static final String STREAM_FIELD_NAMES_PATH = "/internal/select/stream_field_names";
  public static final String STREAM_FIELD_VALUES_PATH = "/internal/select/stream_field_values";
  public static final String STREAMS_PATH = "/internal/select/streams";
  public static final String STREAM_IDS_PATH = "/internal/select/stream_ids";

  public static final List<String> ALL_PATHS =
      List.of(
          QUERY_PATH,
          FIELD_NAMES_PATH,
          FIELD_VALUES_PATH,
          STREAM_FIELD_NAMES_PATH,
          STREAM_FIELD_VALUES_PATH,
          STREAMS_PATH,
          STREAM_IDS_PATH);

  public static final String QUERY_PROTOCOL_VERSION = "v1";
  public static final String FIELD_NAMES_PROTOCOL_VERSION = "v1";
  public static final String FIELD_VALUES_PROTOCOL_VERSION = "v1";
  public static final String STREAM_FIELD_NAMES_PROTOCOL_VERSION = "v1";
  public static final String STREAM_FIELD_VALUES_PROTOCOL_VERSION = "v1";
  public static final String STREAMS_PROTOCOL_VERSION = "v1";
  public static final String STREAM_IDS_PROTOCOL_VERSION = "v1";

  public static final String VERSION_PARAM = "version";
  public static final String TENANT_IDS_PARAM = "tenant_ids";
  public static final String QUERY_PARAM = "query";
  public static final String TIMESTAMP_PARAM = "timestamp";
  public static final String DISABLE_COMPRESSION_PARAM = "disable_compression";
  public static final String FIELD_PARAM = "field";
  public static final String LIMIT_PARAM = "limit";

  private InternalSelectProtocol() {}
}
