/**
 * Concrete release-tooling workflows and the catalog that registers them.
 */
package com.ryuqq.conductor.workflow;
