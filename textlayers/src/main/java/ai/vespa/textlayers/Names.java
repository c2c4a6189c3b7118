// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.regex.Pattern;

/**
 * Validation of layer and attribute names.
 */
final class Names {

    private static final Pattern identifier = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

    private Names() {}

    static void requireIdentifier(String name, String kind) {
        if (name == null || ! identifier.matcher(name).matches())
            throw new InvalidNameException("Illegal " + kind + " name '" + name + "': must match " + identifier);
    }

}
