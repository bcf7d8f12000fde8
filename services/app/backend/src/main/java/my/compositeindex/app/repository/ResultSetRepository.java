package my.compositeindex.app.repository;

import my.compositeindex.app.domain.StoredResultSet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ResultSetRepository extends JpaRepository<StoredResultSet, String> {
	@Query("select r from StoredResultSet r order by r.createdAt desc")
	List<StoredResultSet> findAllOrderByCreatedAtDesc();

	List<StoredResultSet> findByWeightModelIdOrderByCreatedAtAsc(String weightModelId);
}
