/**
 * In-memory stand-ins for external collaborators (model registry, approval, audit,
 * permission and resource services, adapter merger).
 *
 * <p>Each fake can be switched into a failing mode so tests can exercise error paths.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.privatefm.adapter.inmemory.external;
