/**
 * Run orchestration and the batch loop of a single job.
 */
package io.github.yok.flexretire.core;
