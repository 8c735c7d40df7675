package com.slack.netselect.logstore;

import com.slack.netselect.codec.TenantId;
import com.slack.netselect.codec.ValueWithHits;
import com.slack.netselect.query.Query;
import io.grpc.Context;
import java.io.IOException;
import java.util.List;

/**
 * Executes queries against log data. Storage nodes implement this over their local data; the
 * select tier implements it by fanning out to storage nodes. Cancelling ctx must make a running
 * call return promptly.
 *
 * <p>Methods that take a limit return at most that many values when it is non-zero.
 */
public interface QueryEngine {

  void runQuery(Context ctx, List<TenantId> tenantIds, Query query, DataBlockWriter writeBlock)
      throws IOException;

  List<ValueWithHits> getFieldNames(Context ctx, List<TenantId> tenantIds, Query query)
      throws IOException;

  List<ValueWithHits> getFieldValues(
      Context ctx, List<TenantId> tenantIds, Query query, String fieldName, long limit)
      throws IOException;

  List<ValueWithHits> getStreamFieldNames(Context ctx, List<TenantId> tenantIds, Query query)
      throws IOException;

  List<ValueWithHits> getStreamFieldValues(
      Context ctx, List<TenantId> tenantIds, Query query, String fieldName, long limit)
      throws IOException;

  List<ValueWithHits> getStreams(Context ctx, List<TenantId> tenantIds, Query query, long limit)
      throws IOException;

  List<ValueWithHits> getStreamIds(Context ctx, List<TenantId> tenantIds, Query query, long limit)
      throws IOException;
}
