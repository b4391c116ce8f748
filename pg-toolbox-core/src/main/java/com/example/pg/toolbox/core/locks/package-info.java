/** Advisory lock keys and acquisition modes shared by the JDBC and R2DBC lock helpers. */
package com.example.pg.toolbox.core.locks;
