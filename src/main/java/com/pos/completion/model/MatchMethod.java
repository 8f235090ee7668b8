package com.pos.completion.model;

/**
 * Identity resolution methods, in cascade order (highest precision first).
 *
 * <ul>
 *   <li>EXACT_STORE_NAME      - catalog store name equals the shop name label.</li>
 *   <li>EXACT_IDENTIFIER      - catalog store id equals the leader label.</li>
 *   <li>STRICT_PARTIAL_NAME   - near-identical token sets with containment.</li>
 *   <li>IDENTIFIER_IN_NAME    - catalog store id appears as a word in the shop name.</li>
 *   <li>LEADER_LABEL_IN_NAME  - leader label appears as a word in the catalog store name.</li>
 *   <li>NONE                  - no method accepted the pair.</li>
 * </ul>
 */
public enum MatchMethod {

    EXACT_STORE_NAME,
    EXACT_IDENTIFIER,
    STRICT_PARTIAL_NAME,
    IDENTIFIER_IN_NAME,
    LEADER_LABEL_IN_NAME,
    NONE
}
