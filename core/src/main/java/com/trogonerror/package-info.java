/**
 * Structured, immutable errors for crossing service and trust boundaries.
 *
 * <p>The central classes are:
 *
 * <ul>
 *   <li>{@link com.trogonerror.TrogonError} - the error value: code, message, domain/reason
 *       identity, visibility-tagged metadata, retry guidance, help links, debug info, causes
 *   <li>{@link com.trogonerror.Code} - classification codes with their default messages and HTTP
 *       statuses
 *   <li>{@link com.trogonerror.Visibility} - disclosure tiers used to tag fields
 *   <li>{@link com.trogonerror.ErrorTemplate} - reusable definition stamping out one kind of error
 *   <li>{@link com.trogonerror.TrogonErrors} - lookups along an exception chain
 *   <li>{@link com.trogonerror.ErrorFormatter} - the deterministic text rendering
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>
 * static final ErrorTemplate USER_NOT_FOUND =
 *     ErrorTemplate.of("myapp.users", "NOT_FOUND", TemplateOptions.withCode(Code.NOT_FOUND));
 *
 * public User getUser(String userId) {
 *   return repository.find(userId)
 *       .orElseThrow(() -&gt; USER_NOT_FOUND.newError(
 *           ErrorOptions.withMetadataValue(Visibility.PUBLIC, "userId", userId)));
 * }
 *
 * // At the boundary
 * try {
 *   return getUser(userId);
 * } catch (TrogonError e) {
 *   if (USER_NOT_FOUND.is(e)) {
 *     response.status(e.code().httpStatusCode());
 *   }
 *   Logger.error("Failed to get user: {}", e.getMessage());
 * }
 * </pre>
 */
package com.trogonerror;
