/**
 * Error taxonomy and rendering inputs.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.taskflow.domain.error.ErrorCode} - Stable codes with their HTTP status
 *       and severity</li>
 *   <li>{@link fr.lapetina.taskflow.domain.error.StructuredError} - The one exception type
 *       rendered to clients</li>
 *   <li>{@link fr.lapetina.taskflow.domain.error.ErrorMessageCatalog} - User-facing title,
 *       message and action per code</li>
 *   <li>{@link fr.lapetina.taskflow.domain.error.ErrorClassifier} - Maps any throwable to a
 *       structured error</li>
 *   <li>{@link fr.lapetina.taskflow.domain.error.DatabaseErrorMapper} - Maps driver error codes</li>
 * </ul>
 */
package fr.lapetina.taskflow.domain.error;
