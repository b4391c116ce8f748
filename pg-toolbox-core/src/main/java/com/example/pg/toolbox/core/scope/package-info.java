/** State machine shared by the JDBC and R2DBC session scopes. */
package com.example.pg.toolbox.core.scope;
