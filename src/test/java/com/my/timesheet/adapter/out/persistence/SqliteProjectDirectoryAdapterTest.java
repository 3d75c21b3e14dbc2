package com.my.timesheet.adapter.out.persistence;

import com.my.timesheet.domain.model.Location;
import com.my.timesheet.domain.model.Project;
import com.my.timesheet.domain.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteProjectDirectoryAdapterTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private SqliteProjectDirectoryAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = SqliteFixture.open(tempDir);
        SqliteFixture.exec(dataSource,
                "INSERT INTO projects(id, name) VALUES (1, 'Alpha'), (2, 'alpha'), (3, 'Obra Ágil')",
                "INSERT INTO project_members(project_id, user_id) VALUES (1, 42)",
                "INSERT INTO tasks(id, project_id, name, is_active) VALUES (10, 1, 'Old', 0), (11, 1, 'Build', 1), (12, 1, 'Paint', 1)",
                "INSERT INTO locations(id, name, is_active) VALUES (20, 'Closed site', 0), (21, 'Office', 1), (22, 'Yard', 1)",
                "INSERT INTO task_locations(task_id, location_id) VALUES (11, 22), (11, 21)");
        adapter = new SqliteProjectDirectoryAdapter(dataSource);
    }

    @Test
    void findsProjectsByNameIgnoringCase() {
        assertThat(adapter.findProjectsByName(" ALPHA ")).containsExactly(new Project(1, "Alpha"), new Project(2, "alpha"));
        assertThat(adapter.findProjectsByName("obra ágil")).containsExactly(new Project(3, "Obra Ágil"));
        assertThat(adapter.findProjectsByName("Beta")).isEmpty();
        assertThat(adapter.findProjectsByName(" ")).isEmpty();
        assertThat(adapter.findAllProjects()).extracting(Project::id).containsExactly(1L, 2L, 3L);
        assertThat(adapter.findProject(3)).contains(new Project(3, "Obra Ágil"));
    }

    @Test
    void checksMembership() {
        assertThat(adapter.isProjectMember(1, 42)).isTrue();
        assertThat(adapter.isProjectMember(2, 42)).isFalse();
    }

    @Test
    void defaultTaskPrefersActiveThenLowestId() {
        assertThat(adapter.findDefaultTask(1)).contains(new Task(11, 1, "Build", true));
        assertThat(adapter.findDefaultTask(2)).isEmpty();
        assertThat(adapter.findTask(10, 1)).contains(new Task(10, 1, "Old", false));
        assertThat(adapter.findTask(10, 2)).isEmpty();
    }

    @Test
    void resolvesLocations() {
        assertThat(adapter.findFirstTaskLocation(11)).contains(new Location(21, "Office", true));
        assertThat(adapter.findFirstTaskLocation(12)).isEmpty();
        assertThat(adapter.findFallbackLocation()).contains(new Location(21, "Office", true));
        assertThat(adapter.findLocation(20)).contains(new Location(20, "Closed site", false));
    }
}
