/**
 * Orchestrator 예외 계층.
 *
 * <pre>
 * OrchestratorException
 *   ├─ ValidationException
 *   ├─ ConflictException
 *   ├─ NamespaceNotFoundException
 *   ├─ OperationNotFoundException
 *   ├─ UnauthorizedException
 *   ├─ TransientException  (재시도)
 *   └─ FatalException      (CORRUPTED 승격)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.core.exception;
