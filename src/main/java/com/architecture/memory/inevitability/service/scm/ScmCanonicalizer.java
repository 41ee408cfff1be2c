package com.architecture.memory.inevitability.service.scm;

import com.architecture.memory.inevitability.exception.CausalAnalysisException;
import com.architecture.memory.inevitability.model.scm.StructuralCausalModel;
import com.architecture.memory.inevitability.service.cache.CacheKeyGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

/**
 * Produces the canonical serialization of an SCM and the version derived from it.
 *
 * Canonical form:
 * - Properties sorted alphabetically, map entries sorted by key
 * - Collections already sorted by the builder, so equal graphs give byte-identical output
 * - Version and source graph excluded
 *
 * Version format: scm:v1:{sha256 of canonical json}
 */
@Component
public class ScmCanonicalizer {

    private static final String VERSION_PREFIX = "scm:v1:";

    private final ObjectMapper mapper = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    public String serialize(StructuralCausalModel scm) {
        try {
            return mapper.writeValueAsString(scm);
        } catch (JsonProcessingException e) {
            throw new CausalAnalysisException("Failed to serialize SCM: " + e.getMessage(), e);
        }
    }

    public String version(StructuralCausalModel scm) {
        return VERSION_PREFIX + CacheKeyGenerator.sha256Hex(serialize(scm));
    }

    /**
     * Returns a copy of the model stamped with its canonical version.
     */
    public StructuralCausalModel stamp(StructuralCausalModel scm) {
        return scm.toBuilder().version(version(scm)).build();
    }
}
