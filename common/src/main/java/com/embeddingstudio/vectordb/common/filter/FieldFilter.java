package com.embeddingstudio.vectordb.common.filter;

/**
 * A filter leaf addressing one field. With {@code forceNotPayload} the field names a stored
 * column ({@code object_id}, {@code original_id}, {@code user_id}, {@code session_id}) instead of a payload key.
 */
public interface FieldFilter {

    String field();

    boolean forceNotPayload();
}
