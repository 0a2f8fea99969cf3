/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri} - set by {@link com.phillippitts.voiceforge.config.logging.MdcFilter}
 *       for every HTTP request</li>
 *   <li>{@code sessionId} - set while a session mailbox runs</li>
 *   <li>{@code pool} - task type, set on a pool's dispatch thread</li>
 * </ul>
 */
package com.phillippitts.voiceforge.config.logging;
