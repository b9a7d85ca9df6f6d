package com.ascesis.api;

import com.ascesis.core.model.CausalContent;
import com.ascesis.core.model.ContextHandle;

/**
 * The outcome of compiling a definitions file.
 *
 * @param rootName    name of the structure chosen as root
 * @param rootContent compiled content of the root structure
 * @param context     the context holding every compiled structure and the
 *                    declared node properties
 */
public record CompilationResult(String rootName, CausalContent rootContent, ContextHandle context) {
}
