package my.compositeindex.app.repository;

import my.compositeindex.app.domain.StoredWeightModel;
import my.compositeindex.app.engine.WeightMethod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface WeightModelRepository extends JpaRepository<StoredWeightModel, String> {
	@Query("select m from StoredWeightModel m order by m.createdAt desc")
	List<StoredWeightModel> findAllOrderByCreatedAtDesc();

	List<StoredWeightModel> findByMethodOrderByCreatedAtAsc(WeightMethod method);
}
