package com.example.statstore.engine.key;

import lombok.Value;

/**
 * Result of decoding a store key. For {@link StatField#CONTEXTS} keys the label is the context id.
 */
@Value
public class DecodedKey {
    String label;
    StatField field;
}
