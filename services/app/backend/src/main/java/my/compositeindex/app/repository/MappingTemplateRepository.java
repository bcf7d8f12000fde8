package my.compositeindex.app.repository;

import my.compositeindex.app.domain.MappingTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface MappingTemplateRepository extends JpaRepository<MappingTemplate, String> {
	@Query("select t from MappingTemplate t order by t.createdAt desc")
	List<MappingTemplate> findAllOrderByCreatedAtDesc();
}
