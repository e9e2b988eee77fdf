/**
 * GitHub Mirror core package.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.mirror;

import org.jspecify.annotations.NullMarked;
