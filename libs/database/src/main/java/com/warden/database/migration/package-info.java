/** Flyway configuration for the control-plane schema. */
package com.warden.database.migration;
