package my.compositeindex.app.repository;

import my.compositeindex.app.domain.DatasetMapping;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DatasetMappingRepository extends JpaRepository<DatasetMapping, String> {
}
