package com.slack.netselect.codec;

import com.google.common.io.BaseEncoding;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Identifies a tenant by account and project. Both ids are unsigned 32-bit values on the wire.
 *
 * <p>A tenant scope (the list of tenants a query may touch) travels as the {@code tenant_ids}
 * request parameter: a varuint count followed by the id pairs, base64url encoded without padding.
 */
public record TenantId(int accountId, int projectId) {
  private static final BaseEncoding PARAM_ENCODING = BaseEncoding.base64Url().omitPadding();

  public static byte[] marshalTenantIds(List<TenantId> tenantIds) {
    ByteArrayOutputStream dst = new ByteArrayOutputStream();
    BinaryEncoding.writeVarUint(dst, tenantIds.size());
    for (TenantId tenantId : tenantIds) {
      BinaryEncoding.writeUint32(dst, tenantId.accountId);
      BinaryEncoding.writeUint32(dst, tenantId.projectId);
    }
    return dst.toByteArray();
  }

  public static List<TenantId> unmarshalTenantIds(byte[] src) throws IOException {
    ByteBuffer buf = ByteBuffer.wrap(src);
    long count = BinaryEncoding.readVarUint(buf, "tenant count");
    if (count < 0 || count > buf.remaining() / (2L * Integer.BYTES)) {
      throw new IOException(
          String.format(
              "cannot unmarshal %s tenants from %d bytes",
              Long.toUnsignedString(count), buf.remaining()));
    }
    List<TenantId> tenantIds = new ArrayList<>((int) count);
    for (int i = 0; i < count; i++) {
      int accountId = BinaryEncoding.readUint32(buf, "accountID of tenant #" + i);
      int projectId = BinaryEncoding.readUint32(buf, "projectID of tenant #" + i);
      tenantIds.add(new TenantId(accountId, projectId));
    }
    if (buf.hasRemaining()) {
      throw new IOException(
          String.format("unexpected %d trailing bytes after tenant ids", buf.remaining()));
    }
    return tenantIds;
  }

  public static String toParam(List<TenantId> tenantIds) {
    return PARAM_ENCODING.encode(marshalTenantIds(tenantIds));
  }

  public static List<TenantId> fromParam(String param) throws IOException {
    byte[] raw;
    try {
      raw = PARAM_ENCODING.decode(param);
    } catch (IllegalArgumentException e) {
      throw new IOException("cannot decode tenant_ids=" + param, e);
    }
    return unmarshalTenantIds(raw);
  }

  @Override
  public String toString() {
    return Integer.toUnsignedString(accountId) + ":" + Integer.toUnsignedString(projectId);
  }
}
