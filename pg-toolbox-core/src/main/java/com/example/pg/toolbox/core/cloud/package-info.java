/** Detection of managed cloud PostgreSQL offerings. */
package com.example.pg.toolbox.core.cloud;
