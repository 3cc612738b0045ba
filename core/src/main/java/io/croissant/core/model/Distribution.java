package io.croissant.core.model;

import java.util.List;

/** A file, or a set of files, backing the dataset. */
public sealed interface Distribution extends Node permits FileObject, FileSet {

    String encodingFormat();

    /** Uids of the distributions this one is extracted from; empty when top-level. */
    List<String> containedIn();
}
