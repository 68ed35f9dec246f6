package com.deepansh.sectools.nvd;

import com.deepansh.sectools.core.ExternalCallResult;

import java.util.Map;

/**
 * Read-only access to the NVD CVE API 2.0.
 *
 * The endpoint is fixed by configuration. Callers contribute query
 * parameters only, so the API key header can never be sent anywhere else.
 */
public interface NvdClient {

    ExternalCallResult query(Map<String, ?> queryParams);
}
