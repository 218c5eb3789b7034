/**
 * Collaborators that shell out to {@code git} and {@code npx}.
 */
package com.ryuqq.conductor.workflow.process;
