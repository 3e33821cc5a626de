package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

/**
 * Common view of all top-level declarations carried by a {@link FileDeclaration}.
 */
public interface Declaration {

    /**
     * @return The stable declaration id, see {@link DeclarationIds}.
     */
    String id();

    String name();

    /**
     * @return The file declaring this element.
     */
    FileIdentity file();

    SourceLocation location();
}
