package my.budgetcoach.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BudgetCoachApplication {
	public static void main(String[] args) {
		SpringApplication.run(BudgetCoachApplication.class, args);
	}
}
