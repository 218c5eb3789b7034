/**
 * Filesystem-backed artifact storage.
 */
package com.ryuqq.conductor.workflow.storage;
