package dev.mars.spacetime.db.schema;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SqlTemplateTest {

    @Test
    void testKindTemplatesUseKindTables() {
        assertEquals("SELECT * FROM raster3d_base WHERE id = ?", SqlTemplate.SELECT_MAP_BASE.render(DatasetKind.RASTER3D));
        assertEquals("DELETE FROM stvds_base WHERE id = ?", SqlTemplate.DELETE_STDS_BASE.render(DatasetKind.VECTOR));
    }

    @Test
    void testTableTemplatesValidateTableNames() {
        assertEquals("INSERT INTO temp_permanent_raster_register (id) VALUES (?)",
            SqlTemplate.INSERT_REGISTER_ENTRY.render("temp_permanent_raster_register"));
        assertThrows(IllegalArgumentException.class,
            () -> SqlTemplate.INSERT_REGISTER_ENTRY.render("x; DROP TABLE strds_base"));
    }

    @Test
    void testScopeIsEnforced() {
        assertThrows(IllegalStateException.class, () -> SqlTemplate.SELECT_MAP_BASE.render("some_table"));
        assertThrows(IllegalStateException.class, () -> SqlTemplate.DROP_REGISTER_TABLE.render(DatasetKind.RASTER));
    }

    @Test
    void testSchemaTemplatesSplitIntoStatements() {
        List<String> statements = TemporalSchemaInitializer.parseSqlStatements(SqlTemplate.MAP_TABLES.render(DatasetKind.RASTER));
        assertEquals(3, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS raster_base"));
        assertFalse(statements.get(2).endsWith(";"));
    }
}
