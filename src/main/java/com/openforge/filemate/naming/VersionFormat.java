package com.openforge.filemate.naming;

/** How a version tag is advanced when a newer copy of a document arrives. */
public enum VersionFormat {

    /** v1.0 → v1.1 */
    SIMPLE,

    /** v1.0.0 → v1.0.1 */
    SEMANTIC
}
