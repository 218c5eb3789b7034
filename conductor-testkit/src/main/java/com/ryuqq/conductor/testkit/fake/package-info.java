/**
 * Scripted collaborator fakes and a controllable clock for workflow and runner tests.
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.testkit.fake;
