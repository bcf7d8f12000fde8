package my.compositeindex.app.repository;

import my.compositeindex.app.domain.Dataset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface DatasetRepository extends JpaRepository<Dataset, String> {
	@Query("select d from Dataset d order by d.createdAt desc")
	List<Dataset> findAllOrderByCreatedAtDesc();

	Optional<Dataset> findFirstBySampleTrueOrderByCreatedAtAsc();
}
