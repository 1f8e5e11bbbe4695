/**
 * Service Provider Interfaces for every external collaborator.
 *
 * <p>Repositories, the checkpoint store, work queues and the approval/audit/model
 * collaborators are all reached through these interfaces. The in-memory adapter
 * module provides a thread-safe implementation of each.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.privatefm.core.spi;
