package com.ivamare.pipeline.stage;

import java.util.List;
import java.util.Map;

/**
 * Lists document URLs for a bulk ingestion.
 */
public interface DocumentSource {

    List<String> listUrls(Map<String, Object> payload) throws Exception;
}
