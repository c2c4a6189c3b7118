// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Holds the object mapper shared by the readers and writers of this package.
 * It must not be reconfigured: derive an ObjectWriter or ObjectReader for variations.
 */
final class Jackson {

    private static final ObjectMapper mapperInstance = createMapper();

    private Jackson() {}

    private static ObjectMapper createMapper() {
        JsonFactory jsonFactory = new JsonFactoryBuilder()
                .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
                .build();
        return new ObjectMapper(jsonFactory);
    }

    static ObjectMapper mapper() { return mapperInstance; }

}
