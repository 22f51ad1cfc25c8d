package com.beancount.langserver.loader.reference;

import com.beancount.langserver.loader.LoadResult;
import com.beancount.langserver.loader.LoaderException;
import java.nio.file.Path;

/**
 * The authoritative ledger loader the tree walker is checked against. It is also the only engine
 * able to read encrypted ledgers.
 */
@FunctionalInterface
public interface ReferenceEngine {

    LoadResult load(Path root) throws LoaderException;
}
