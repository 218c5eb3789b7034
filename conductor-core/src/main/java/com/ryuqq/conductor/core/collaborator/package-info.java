/**
 * Ports of the external collaborators used by the workflows: version control, AI provider,
 * release tool and artifact storage.
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.collaborator;
