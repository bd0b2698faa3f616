/**
 * GitHub Team Health core package.
 *
 * <p>
 * Sprint bucketing, GitHub issue and pull request synchronization and the speed, quality
 * and consistency evaluators. Persistence and the AI model are reached through the store
 * and {@link org.springaicommunity.github.teamhealth.StructuredOutputService} interfaces.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.NullMarked;
