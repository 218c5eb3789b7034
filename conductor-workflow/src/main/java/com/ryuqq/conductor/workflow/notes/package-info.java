/**
 * Conventional-commit parsing and structured release-notes rendering.
 */
package com.ryuqq.conductor.workflow.notes;
