/**
 * Unit-of-work protocol: participants, a local coordinator and an XA two-phase coordinator.
 */
package io.github.yok.flexretire.db.tx;
