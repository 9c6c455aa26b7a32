package com.toolflow.api;

import com.toolflow.engine.task.TaskManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "toolflow.storage=memory")
@AutoConfigureMockMvc
class ToolflowApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TaskManager taskManager;

    @Test
    void contextLoads_andServesTasks() throws Exception {
        String id = taskManager.createTask("smoke", null, null).id();

        mockMvc.perform(get("/api/v1/tasks/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("pending"))
            .andExpect(jsonPath("$.createdAt").isString());
    }
}
